package com.funnelscope.funnel.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventPropertiesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void nullValuesCountAsAbsent() {
        Map<String, Object> values = new HashMap<>();
        values.put("browser", "Chrome");
        values.put("referrer", null);
        EventProperties props = EventProperties.of(values);

        assertThat(props.has("browser")).isTrue();
        assertThat(props.has("referrer")).isFalse();
        assertThat(props.get(null)).isNull();
    }

    @Test
    void sharedEmptyInstanceIsReadOnly() {
        assertThat(EventProperties.of(Map.of())).isSameAs(EventProperties.empty());
        assertThrows(UnsupportedOperationException.class, () -> EventProperties.empty().put("k", "v"));
    }

    @Test
    void serializesAsPlainObject() throws Exception {
        EventProperties props = EventProperties.of(Map.of("plan", "pro"));

        assertThat(mapper.writeValueAsString(props)).isEqualTo("{\"plan\":\"pro\"}");
        assertThat(mapper.readValue("{\"plan\":\"pro\",\"seats\":3}", EventProperties.class).get("seats"))
                .isEqualTo(3);
    }
}
