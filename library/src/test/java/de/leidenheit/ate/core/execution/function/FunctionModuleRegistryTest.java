package de.leidenheit.ate.core.execution.function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import de.leidenheit.ate.core.exception.AteException;
import de.leidenheit.ate.core.exception.RequireImportException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionModuleRegistryTest {

    private final FunctionModuleRegistry registry = FunctionModuleRegistry.ofDefault();

    @Test
    void shouldProvideDefaultModules() {
        // when & then
        assertThat(registry.find("random")).isPresent();
        assertThat(registry.find("hashlib")).isPresent();
        assertThat(registry.find("time")).isPresent();
        assertThat(registry.find("base64")).isPresent();
        assertThat(registry.find("os")).isEmpty();
    }

    @Test
    void shouldThrowRequireImportExceptionOnUnknownModule() {
        // when & then
        assertThatThrownBy(() -> registry.lookup("os"))
                .isInstanceOf(RequireImportException.class)
                .satisfies(e -> assertThat(((RequireImportException) e).getModuleName()).isEqualTo("os"));
    }

    @Test
    void shouldComputeKnownDigests() {
        // given
        var hashlib = registry.lookup("hashlib").getFunctions();

        // when & then
        assertThat(call(hashlib, "md5", TextNode.valueOf("abc")).asText())
                .isEqualTo("900150983cd24fb0d6963f7d28e17f72");
        assertThat(call(hashlib, "md5").asText())
                .isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
        assertThat(call(hashlib, "md5", TextNode.valueOf("a"), TextNode.valueOf("bc")).asText())
                .isEqualTo("900150983cd24fb0d6963f7d28e17f72");
        assertThat(call(hashlib, "sha256", TextNode.valueOf("abc")).asText())
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void shouldEncodeAndDecodeBase64() {
        // given
        var base64 = registry.lookup("base64").getFunctions();

        // when & then
        assertThat(call(base64, "b64encode", TextNode.valueOf("hello")).asText()).isEqualTo("aGVsbG8=");
        assertThat(call(base64, "b64decode", TextNode.valueOf("aGVsbG8=")).asText()).isEqualTo("hello");
    }

    @Test
    void shouldGenerateRandomValues() {
        // given
        var random = registry.lookup("random").getFunctions();

        // when
        var text = call(random, "gen_random_string", IntNode.valueOf(12));
        var number = call(random, "randint", IntNode.valueOf(3), TextNode.valueOf("5"));
        var uuid = call(random, "uuid4");

        // then
        assertThat(text.asText()).hasSize(12).matches("[A-Za-z0-9]+");
        assertThat(number.asInt()).isBetween(3, 5);
        assertThat(uuid.asText()).matches("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    @Test
    void shouldRejectWrongArguments() {
        // given
        var random = registry.lookup("random").getFunctions();

        // when & then
        assertThatThrownBy(() -> call(random, "gen_random_string"))
                .isInstanceOf(AteException.class)
                .hasMessageContaining("gen_random_string()");
        assertThatThrownBy(() -> call(random, "gen_random_string", TextNode.valueOf("many")))
                .isInstanceOf(AteException.class)
                .hasMessageContaining("expects an integer");
    }

    @Test
    void shouldRejectIntegersOutsideIntRange() {
        // given
        var random = registry.lookup("random").getFunctions();

        // when & then
        assertThatThrownBy(() -> call(random, "randint", IntNode.valueOf(0), LongNode.valueOf(1L << 40)))
                .isInstanceOf(AteException.class)
                .hasMessageContaining("randint() expects an integer at position 1");
        assertThatThrownBy(() -> call(random, "gen_random_string", TextNode.valueOf("99999999999")))
                .isInstanceOf(AteException.class)
                .hasMessageContaining("expects an integer");
    }

    @Test
    void shouldReadTimeFromClock() {
        // given
        var clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        var time = new TimeFunctions(clock).getFunctions();

        // when & then
        assertThat(call(time, "timestamp").asLong()).isEqualTo(1714564800L);
        assertThat(call(time, "timestamp_millis").asLong()).isEqualTo(1714564800000L);
        assertThat(call(time, "iso_now").asText()).isEqualTo("2024-05-01T12:00:00Z");
    }

    @Test
    void shouldReplaceModuleOnRegister() {
        // given
        var custom = new FunctionModule() {
            @Override
            public String getName() {
                return "random";
            }

            @Override
            public Map<String, AteFunction> getFunctions() {
                return Map.of("uuid4", args -> TextNode.valueOf("fixed"));
            }
        };

        // when
        registry.register(custom);

        // then
        assertThat(call(registry.lookup("random").getFunctions(), "uuid4").asText()).isEqualTo("fixed");
    }

    private JsonNode call(final Map<String, AteFunction> functions, final String name, final JsonNode... args) {
        return functions.get(name).apply(List.of(args));
    }
}
