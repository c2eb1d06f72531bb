package io.github.yok.boson.app;

import static io.github.yok.boson.app.ConfiguredOperatorFactoryTest.factor;
import static io.github.yok.boson.app.ConfiguredOperatorFactoryTest.input;
import static io.github.yok.boson.app.ConfiguredOperatorFactoryTest.term;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.FactorKind;
import io.github.yok.boson.core.conversion.QuadratureConverter;
import io.github.yok.boson.core.ordering.NormalOrderer;
import io.github.yok.boson.core.realization.FockSpaceRealizer;
import io.github.yok.boson.core.weyl.WeylQuantizer;
import io.github.yok.boson.out.CsvResultWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BosonAlgebraCliRunnerTest {

    @TempDir
    Path tempDir;

    private BosonAlgebraCliRunner runner(BosonAlgebraProperties properties) {
        QuadratureConverter converter = new QuadratureConverter(properties.getHbar());
        OperatorPipeline pipeline = new OperatorPipeline(new NormalOrderer(properties.getHbar()),
                converter, new WeylQuantizer(), new FockSpaceRealizer(converter),
                properties.getPipeline(), properties.getRealization());
        return new BosonAlgebraCliRunner(properties, new ConfiguredOperatorFactory(), pipeline,
                new CsvResultWriter(tempDir.toString()));
    }

    @Test
    void runWritesResultFiles() {
        BosonAlgebraProperties properties = new BosonAlgebraProperties();
        BosonAlgebraProperties.Input in = input(Algebra.LADDER,
                term(1.0, 0.0, factor(0, FactorKind.LOWER), factor(0, FactorKind.RAISE)));
        in.setLabel("cli");
        properties.setInput(in);
        properties.getRealization().setTruncation(3);

        runner(properties).run();

        assertThat(tempDir.resolve("boson_terms_cli.csv")).exists();
        assertThat(tempDir.resolve("boson_matrix_cli.csv")).exists();
        assertThat(tempDir.resolve("boson_meta_cli.csv")).exists();
    }

    @Test
    void emptyLabelIsRejected() {
        BosonAlgebraProperties properties = new BosonAlgebraProperties();
        BosonAlgebraProperties.Input in = input(Algebra.LADDER, term(1.0, 0.0));
        in.setLabel("");
        properties.setInput(in);

        assertThatThrownBy(() -> runner(properties).run()).isInstanceOf(IllegalStateException.class);
    }
}
