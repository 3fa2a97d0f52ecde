package tech.yump.audit.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.audit.adapter.UnsupportedMethodException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryCodecTest {

    private final QueryCodec codec = new QueryCodec(new ObjectMapper());

    @Test
    @DisplayName("queries are structurally equal")
    void query_structuralEquality() {
        assertThat(Query.equal("userId", "u1")).isEqualTo(Query.equal("userId", "u1"));
        assertThat(Query.in("event", List.of("a", "b"))).isEqualTo(new Query(QueryMethod.IN, "event", List.of("a", "b")));
        assertThat(Query.orderDesc()).isEqualTo(Query.orderDesc("time"));
        assertThat(Query.limit(10)).isNotEqualTo(Query.limit(11));
    }

    @Test
    @DisplayName("factories perform no validation")
    void query_noValidationAtConstruction() {
        Query query = Query.equal("definitely not an attribute", null);

        assertThat(query.attribute()).isEqualTo("definitely not an attribute");
        assertThat(query.values()).containsExactly((Object) null);
        assertThat(Query.limit(-5).value()).isEqualTo(-5);
    }

    @Test
    @DisplayName("toJson writes method, attribute and values, omitting an empty attribute")
    void toJson() {
        assertThat(codec.toJson(Query.equal("userId", "u1")))
                .isEqualTo("{\"method\":\"equal\",\"attribute\":\"userId\",\"values\":[\"u1\"]}");
        assertThat(codec.toJson(Query.in("event", List.of("create", "delete"))))
                .isEqualTo("{\"method\":\"contains\",\"attribute\":\"event\",\"values\":[\"create\",\"delete\"]}");
        assertThat(codec.toJson(Query.limit(25)))
                .isEqualTo("{\"method\":\"limit\",\"values\":[25]}");
    }

    @Test
    @DisplayName("parse reads every method by its wire name")
    void parse() {
        assertThat(codec.parse("{\"method\":\"between\",\"attribute\":\"time\",\"values\":[\"2024-01-01T00:00:00Z\",\"2024-02-01T00:00:00Z\"]}"))
                .isEqualTo(Query.between("time", "2024-01-01T00:00:00Z", "2024-02-01T00:00:00Z"));
        assertThat(codec.parse("{\"method\":\"offset\",\"values\":[50]}")).isEqualTo(Query.offset(50));
        assertThat(codec.parse("{\"method\":\"orderAsc\",\"attribute\":\"time\"}")).isEqualTo(Query.orderAsc());
        assertThat(codec.parseAll(List.of("{\"method\":\"lessThan\",\"attribute\":\"time\",\"values\":[\"x\"]}")))
                .containsExactly(Query.lessThan("time", "x"));
    }

    @Test
    @DisplayName("parse rejects unknown methods and malformed shapes")
    void parse_invalid() {
        assertThatThrownBy(() -> codec.parse("{\"method\":\"like\",\"attribute\":\"userId\",\"values\":[\"u\"]}"))
                .isInstanceOf(UnsupportedMethodException.class)
                .hasMessageContaining("like");
        assertThatThrownBy(() -> codec.parse("[1,2]"))
                .isInstanceOf(UnsupportedMethodException.class)
                .hasMessageContaining("Must be an object");
        assertThatThrownBy(() -> codec.parse("{\"method\":5}"))
                .isInstanceOf(UnsupportedMethodException.class)
                .hasMessageContaining("method");
        assertThatThrownBy(() -> codec.parse("{\"method\":\"equal\",\"attribute\":[],\"values\":[1]}"))
                .isInstanceOf(UnsupportedMethodException.class)
                .hasMessageContaining("attribute");
        assertThatThrownBy(() -> codec.parse("{\"method\":\"equal\",\"attribute\":\"a\",\"values\":\"b\"}"))
                .isInstanceOf(UnsupportedMethodException.class)
                .hasMessageContaining("values");
        assertThatThrownBy(() -> codec.parse("{not json"))
                .isInstanceOf(UnsupportedMethodException.class);
    }
}
