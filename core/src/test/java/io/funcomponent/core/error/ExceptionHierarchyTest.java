package io.funcomponent.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.funcomponent.core.model.PassingStyle;
import org.junit.jupiter.api.Test;

/** Tests for the compilation exception hierarchy: common fields and every concrete type. */
class ExceptionHierarchyTest {

    @Test
    void componentExceptionIsAbstractAndUnchecked() {
        assertThat(ComponentException.class).isAbstract();
        assertThat(ComponentException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void configurationExceptionCarriesFunctionAndPhase() {
        var ex = new ConfigurationException("image conflict", "add", ComponentException.Phase.ASSEMBLY);

        assertThat(ex).isInstanceOf(ComponentException.class);
        assertThat(ex.functionName()).isEqualTo("add");
        assertThat(ex.detail()).isEqualTo("image conflict");
        assertThat(ex.phase()).isEqualTo(ComponentException.Phase.ASSEMBLY);
    }

    @Test
    void unsupportedPassingStyleNamesTheStyle() {
        var ex = new UnsupportedPassingStyleException(PassingStyle.BY_RETURN_VALUE, "f");

        assertThat(ex).isInstanceOf(ComponentException.class);
        assertThat(ex.getMessage()).isEqualTo("Unexpected data passing style: 'BY_RETURN_VALUE'");
        assertThat(ex.passingStyle()).isEqualTo(PassingStyle.BY_RETURN_VALUE);
        assertThat(ex.phase()).isEqualTo(ComponentException.Phase.ASSEMBLY);
    }

    @Test
    void valueSerializationExceptionCarriesTypeName() {
        var cause = new IllegalStateException("boom");
        var ex = new ValueSerializationException("bad default", cause, "scale", "Integer");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.functionName()).isEqualTo("scale");
        assertThat(ex.typeName()).isEqualTo("Integer");
        assertThat(ex.phase()).isEqualTo(ComponentException.Phase.ANALYSIS);
        assertThat(new ValueSerializationException("no function", "Float").functionName()).isNull();
    }

    @Test
    void definitionParseExceptionCarriesSource() {
        var ex = new DefinitionParseException("bad yaml", "f", "/defs/f.yaml");

        assertThat(ex.source()).isEqualTo("/defs/f.yaml");
        assertThat(ex.phase()).isEqualTo(ComponentException.Phase.ANALYSIS);
    }
}
