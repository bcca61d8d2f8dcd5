package io.botpoll.json.spi;

import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTypeTest {

    @Test
    void nestedTypesCompareStructurally() {
        ValueType<List<String>> strings = ValueType.listOf(String.class);
        ValueType<Map<String, List<String>>> map = ValueType.parameterized(Map.class, ValueType.of(String.class), strings);

        assertThat(strings).isEqualTo(ValueType.listOf(ValueType.of(String.class)));
        assertThat(strings).isNotEqualTo(ValueType.listOf(Integer.class));
        assertThat(map.parameters()).containsExactly(ValueType.of(String.class), strings);
        assertThat(map.toString()).isEqualTo("java.util.Map<java.lang.String, java.util.List<java.lang.String>>");
    }

    @Test
    void discoveryFailsWithoutProvider() throws Exception {
        try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
            assertThatThrownBy(() -> JsonCodecs.discover(empty))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("JsonCodecProvider");
        }
    }
}
