package io.github.yok.boson;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.boson.app.BosonAlgebraCliRunner;
import io.github.yok.boson.app.BosonAlgebraProperties;
import io.github.yok.boson.app.ConfiguredOperatorFactory;
import io.github.yok.boson.app.OperatorPipeline;
import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.ordering.NormalOrderer;
import io.github.yok.boson.out.OperatorReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = {"boson.cli.enabled=false", "boson.hbar=2.0"})
class BosonAlgebraApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private BosonAlgebraProperties properties;

    @Autowired
    private ConfiguredOperatorFactory factory;

    @Autowired
    private OperatorPipeline pipeline;

    @Test
    void bindsPropertiesAndSkipsCliRunner() {
        assertThat(properties.getHbar()).isEqualTo(2.0);
        assertThat(properties.getInput().getLabel()).isEqualTo("displaced-oscillator");
        assertThat(properties.getInput().getAlgebra()).isEqualTo(Algebra.LADDER);
        assertThat(properties.getInput().getTerms()).hasSize(3);
        assertThat(properties.getRealization().getTruncation()).isEqualTo(6);

        assertThat(context.getBeansOfType(BosonAlgebraCliRunner.class)).isEmpty();
        assertThat(context.getBean(NormalOrderer.class).getHbar()).isEqualTo(2.0);
    }

    @Test
    void configuredInputRunsThroughPipeline() {
        BosonicOperator input = factory.create(properties.getInput());
        OperatorReport report = pipeline.process(properties.getInput().getLabel(), input);

        // b0† b0 + 0.25 b0 b0† + 0.5 → 1.25 b0† b0 + 0.75
        assertThat(report.getResult().isNormalOrdered()).isTrue();
        assertThat(report.getResult().termCount()).isEqualTo(2);
        assertThat(report.getResult().constant().getReal()).isEqualTo(0.75);
        assertThat(report.getRealization().dimension()).isEqualTo(6);
    }
}
