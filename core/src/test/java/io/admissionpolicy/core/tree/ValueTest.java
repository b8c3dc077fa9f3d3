package io.admissionpolicy.core.tree;

import static io.admissionpolicy.core.testkit.TestTrees.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Value tree")
class ValueTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    @DisplayName("map keys keep document order")
    void mapKeepsInsertionOrder() {
        Value value = tree("{\"zeta\": 1, \"alpha\": 2, \"mid\": 3}");

        assertThat(value).isInstanceOf(Value.MapValue.class);
        assertThat(((Value.MapValue) value).entries().keySet()).containsExactly("zeta", "alpha", "mid");
    }

    @Test
    @DisplayName("match dispatches to the variant's function")
    void matchDispatchesByVariant() {
        assertThat(kindOf(tree("{}"))).isEqualTo("map");
        assertThat(kindOf(tree("[1]"))).isEqualTo("array");
        assertThat(kindOf(tree("\"x\""))).isEqualTo("scalar");
        assertThat(kindOf(tree("null"))).isEqualTo("scalar");
    }

    @Test
    @DisplayName("scalar type names cover string, number, boolean and null")
    void scalarTypeNames() {
        assertThat(Value.scalar("s").typeName()).isEqualTo("string");
        assertThat(Value.scalar(1.5).typeName()).isEqualTo("number");
        assertThat(Value.scalar(false).typeName()).isEqualTo("boolean");
        assertThat(Value.nullValue().typeName()).isEqualTo("null");
        assertThat(Value.nullValue().isNull()).isTrue();
    }

    @Test
    @DisplayName("scalar rejects non-scalar raw values")
    void scalarRejectsOtherTypes() {
        assertThatThrownBy(() -> Value.scalar(new Object())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Value.scalar(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("containers are immune to changes of the source collections")
    void defensiveCopies() {
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put("a", Value.scalar(1));
        List<Value> elements = new ArrayList<>(List.of(Value.scalar(1)));

        Value.MapValue map = Value.map(entries);
        Value.ArrayValue array = Value.array(elements);
        entries.put("b", Value.scalar(2));
        elements.add(Value.scalar(2));

        assertThat(map.size()).isEqualTo(1);
        assertThat(array.size()).isEqualTo(1);
        assertThatThrownBy(() -> map.entries().put("c", Value.scalar(3)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("converting to JSON and back yields an equal tree")
    void jsonRoundTrip() throws Exception {
        JsonNode original = JSON.readTree(
                "{\"spec\": {\"containers\": [{\"name\": \"nginx\", \"ports\": [80, 443], \"tty\": false}],"
                        + " \"note\": null}}");

        Value value = Values.fromJson(original);

        assertThat(Values.toJson(value)).isEqualTo(original);
        assertThat(Values.fromJson(Values.toJson(value))).isEqualTo(value);
    }

    private static String kindOf(Value value) {
        return value.match(map -> "map", array -> "array", scalar -> "scalar");
    }
}
