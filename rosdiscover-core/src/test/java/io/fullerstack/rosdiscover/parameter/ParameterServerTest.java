package io.fullerstack.rosdiscover.parameter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ParameterServerTest {

    @Test
    void testGet_MissingKeyReturnsDefaultWithoutStoringIt() {
        ParameterServer params = new ParameterServer();

        ParameterValue value = params.get("/rate", ParameterValue.of(10));

        assertThat(value).isEqualTo(ParameterValue.of(10));
        assertThat(params.contains("/rate")).isFalse();
        assertThat(params.size()).isZero();
    }

    @Test
    void testGet_MissingKeyWithNullDefault() {
        ParameterServer params = new ParameterServer();

        assertThat(params.get("/rate", null)).isNull();
        assertThat(params.get("/rate")).isEmpty();
    }

    @Test
    void testSet_OverwritesExistingValue() {
        ParameterServer params = new ParameterServer();

        params.set("/robot/name", ParameterValue.of("alpha"));
        params.set("/robot/name", ParameterValue.of("beta"));

        assertThat(params.get("/robot/name")).contains(ParameterValue.of("beta"));
        assertThat(params.get("/robot/name", ParameterValue.of("gamma"))).isEqualTo(ParameterValue.of("beta"));
        assertThat(params.size()).isEqualTo(1);
    }

    @Test
    void testNames_AreSorted() {
        ParameterServer params = new ParameterServer();
        params.set("/b", ParameterValue.of(true));
        params.set("/a", ParameterValue.of(false));

        assertThat(params.names()).containsExactly("/a", "/b");
    }

    @Test
    void testUnqualifiedNames_AreRejected() {
        ParameterServer params = new ParameterServer();

        assertThatThrownBy(() -> params.set("rate", ParameterValue.of(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not fully qualified");
        assertThatThrownBy(() -> params.get("~rate", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> params.contains("rate"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
