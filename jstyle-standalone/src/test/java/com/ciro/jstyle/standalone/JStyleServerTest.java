package com.ciro.jstyle.standalone;

import com.ciro.jstyle.LockedStyleSheet;
import com.ciro.jstyle.StyleSheetFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JStyleServerTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final HttpClient client = HttpClient.newHttpClient();

    private JStyleServer server;
    private String base;

    @BeforeEach
    void start() {
        LockedStyleSheet sheet = new LockedStyleSheet(new StyleSheetFactory().create());
        server = new JStyleServer("localhost", 0, sheet, mapper);
        base = "http://localhost:" + server.start();
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    @Test
    void registerThenRenderThenRollback() throws Exception {
        String body = "{\"color\":\"red\",\"@media print\":{\"color\":\"black\"}}";

        HttpResponse<String> registered = send("POST", "/styles", body);
        assertThat(registered.statusCode()).isEqualTo(200);
        JsonNode json = mapper.readTree(registered.body());
        assertThat(json.get("ok").asBoolean()).isTrue();
        String className = json.get("className").asText();

        HttpResponse<String> css = send("GET", "/styles.css", null);
        assertThat(css.statusCode()).isEqualTo(200);
        assertThat(css.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("text/css"));
        assertThat(css.body()).isEqualTo("." + className + "{color:red;}@media print{." + className + "{color:black;}}");

        HttpResponse<String> removed = send("DELETE", "/styles", body);
        assertThat(removed.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(removed.body()).get("className").asText()).isEqualTo(className);

        assertThat(send("GET", "/styles.css", null).body()).isEmpty();
    }

    @Test
    void equalTreesShareOneRule() throws Exception {
        String a = send("POST", "/styles", "{\"background\":\"blue\",\"color\":\"red\"}").body();
        String b = send("POST", "/styles", "{\"color\":\"red\",\"background\":\"blue\"}").body();

        assertThat(mapper.readTree(a).get("className")).isEqualTo(mapper.readTree(b).get("className"));
        assertThat(send("GET", "/styles.css", null).body()).isEqualTo(".jtsac9{background:blue;color:red;}");
    }

    @Test
    void prettyOutputIsFormatted() throws Exception {
        send("POST", "/styles", "{\"backgroundColor\":\"red\"}");

        String pretty = send("GET", "/styles.css?pretty=true", null).body();

        assertThat(pretty).contains(".g75qrj").contains("background-color").contains("\n");
    }

    @Test
    void malformedBodyIsABadRequest() throws Exception {
        HttpResponse<String> response = send("POST", "/styles", "[1,2]");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("code").asText()).isEqualTo("BAD_REQUEST");
    }

    @Test
    void duplicateKeysAreRejected() throws Exception {
        HttpResponse<String> response = send("POST", "/styles", "{\"color\":\"red\",\"color\":\"blue\"}");

        assertThat(response.statusCode()).isEqualTo(400);
    }

    @Test
    void deletingAnUnknownTreeKeepsLiveRules() throws Exception {
        send("POST", "/styles", "{\"color\":\"red\"}");

        HttpResponse<String> removed = send("DELETE", "/styles", "{\"color\":\"red\",\".x\":{\"margin\":0}}");

        assertThat(removed.statusCode()).isEqualTo(200);
        assertThat(send("GET", "/styles.css", null).body()).isEqualTo(".1rscope{color:red;}");
    }

    @Test
    void largeBodiesAndConcurrentWritersAreHandled() throws Exception {
        StringBuilder big = new StringBuilder("{");
        for (int i = 0; i < 4000; i++) {
            if (i > 0) big.append(',');
            big.append("\"--v").append(i).append("\":\"").append("x".repeat(20)).append('"');
        }
        big.append('}');

        HttpRequest request = HttpRequest.newBuilder(URI.create(base + "/styles"))
                .method("POST", HttpRequest.BodyPublishers.ofString(big.toString()))
                .build();

        List<CompletableFuture<HttpResponse<String>>> calls = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            calls.add(client.sendAsync(request, HttpResponse.BodyHandlers.ofString()));
        }

        Set<String> classNames = new HashSet<>();
        for (CompletableFuture<HttpResponse<String>> call : calls) {
            HttpResponse<String> response = call.get(30, TimeUnit.SECONDS);
            assertThat(response.statusCode()).isEqualTo(200);
            classNames.add(mapper.readTree(response.body()).get("className").asText());
        }

        assertThat(classNames).hasSize(1);
        String css = send("GET", "/styles.css", null).body();
        assertThat(css).startsWith("." + classNames.iterator().next() + "{").contains("--v3999:");
    }

    @Test
    void wrongMethodAndUnknownRoute() throws Exception {
        assertThat(send("PUT", "/styles", "{}").statusCode()).isEqualTo(405);
        assertThat(send("POST", "/styles.css", "{}").statusCode()).isEqualTo(405);
        assertThat(send("GET", "/nope", null).statusCode()).isEqualTo(404);
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);

        HttpRequest request = HttpRequest.newBuilder(URI.create(base + path))
                .method(method, publisher)
                .header("Content-Type", "application/json")
                .build();

        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
