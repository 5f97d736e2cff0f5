package com.adforge.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProviderFieldsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("task id is found under data when the top level has none")
    void taskIdUnderData() throws Exception {
        var response = json("{\"code\":200,\"msg\":\"success\",\"data\":{\"taskId\":\"abc123\"}}");
        assertEquals(Optional.of("abc123"), ProviderFields.TASK_ID.text(response));
    }

    @Test
    @DisplayName("result URLs are read from the embedded resultJson document")
    void embeddedResultUrls() throws Exception {
        var response = json("""
                {"code":200,"data":{"state":"success",
                 "resultJson":"{\\"resultUrls\\":[\\"https://cdn/a.mp4\\",\\"https://cdn/b.mp4\\"]}"}}
                """);

        assertEquals(List.of("https://cdn/a.mp4", "https://cdn/b.mp4"), ProviderFields.resultUrls(response, mapper));
    }

    @Test
    @DisplayName("direct result URLs come first and duplicates are dropped")
    void directBeforeEmbedded() throws Exception {
        var response = json("""
                {"data":{"resultUrls":["https://cdn/a.mp4"],
                 "resultJson":"{\\"resultUrls\\":[\\"https://cdn/a.mp4\\",\\"https://cdn/c.mp4\\"]}"}}
                """);

        assertEquals(List.of("https://cdn/a.mp4", "https://cdn/c.mp4"), ProviderFields.resultUrls(response, mapper));
    }

    @Test
    @DisplayName("an unparseable resultJson is ignored")
    void badEmbeddedJson() throws Exception {
        var response = json("{\"data\":{\"resultJson\":\"not json\"}}");
        assertTrue(ProviderFields.resultUrls(response, mapper).isEmpty());
    }

    @Test
    @DisplayName("error detail combines code and the first message field")
    void errorDetail() throws Exception {
        var response = json("{\"code\":422,\"msg\":\"model not supported\"}");
        assertEquals(Optional.of("code=422 model not supported"), ProviderFields.errorDetail(response));
        assertEquals(Optional.of(422), ProviderFields.bodyStatus(response));

        var failed = json("{\"data\":{\"state\":\"fail\",\"failReason\":\"content policy\"}}");
        assertEquals(Optional.of("content policy"), ProviderFields.errorDetail(failed));
    }
}
