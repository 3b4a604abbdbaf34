package com.kkape.agentrpc.codec;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.kkape.agentrpc.error.RemoteServiceException;
import com.kkape.agentrpc.error.ResponseDecodeException;
import com.kkape.agentrpc.message.ConfigResponse;
import com.kkape.agentrpc.message.EnrollmentRequest;
import com.kkape.agentrpc.message.LogCollection;
import com.kkape.agentrpc.message.QueryCollectionResponse;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.LogType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRpcCodecTest {

    @Test
    @DisplayName("Request envelope carries version, method, params and id")
    void testEncodeRequestEnvelope() {
        String json = JsonRpcCodec.encodeRequest("RequestEnrollment", new EnrollmentRequest("s3cret", "host-1",
                EnrollmentDetails.builder().osBuild("22A380").build()));

        JsonObject envelope = JsonParser.parseString(json).getAsJsonObject();
        assertEquals("2.0", envelope.get("jsonrpc").getAsString());
        assertEquals("RequestEnrollment", envelope.get("method").getAsString());
        assertTrue(envelope.has("id"));

        JsonObject params = envelope.getAsJsonObject("params");
        assertEquals("s3cret", params.get("enroll_secret").getAsString());
        assertEquals("host-1", params.get("host_identifier").getAsString());
        assertEquals("22A380", params.getAsJsonObject("EnrollmentDetails").get("os_build_id").getAsString());
    }

    @Test
    @DisplayName("Log type travels as osquery's integer code")
    void testLogTypeIsNumeric() {
        String json = JsonRpcCodec.encodeRequest("PublishLogs", new LogCollection("nk", LogType.STATUS, List.of("a")));

        JsonObject params = JsonParser.parseString(json).getAsJsonObject().getAsJsonObject("params");
        assertEquals(4, params.get("LogType").getAsInt());
        assertEquals("a", params.getAsJsonArray("Logs").get(0).getAsString());
        assertEquals("nk", params.get("node_key").getAsString());
    }

    @Test
    @DisplayName("Result without id decodes")
    void testDecodeResultWithoutId() throws Exception {
        ConfigResponse response = JsonRpcCodec.decodeResult(
                "{\"jsonrpc\":\"2.0\",\"result\":{\"config\":\"{}\",\"node_invalid\":true}}", ConfigResponse.class);

        assertEquals("{}", response.getConfig());
        assertTrue(response.isNodeInvalid());
        assertFalse(response.isDisableDevice());
    }

    @Test
    @DisplayName("Queries result decodes queries, discovery and accelerate")
    void testDecodeQueries() throws Exception {
        QueryCollectionResponse response = JsonRpcCodec.decodeResult("{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":"
                + "{\"Queries\":{\"queries\":{\"q1\":\"select 1\"},\"discovery\":{\"q1\":\"select 2\"},"
                + "\"accelerate\":30},\"disable_device\":false}}", QueryCollectionResponse.class);

        assertEquals("select 1", response.getQueries().getQueries().get("q1"));
        assertEquals("select 2", response.getQueries().getDiscovery().get("q1"));
        assertEquals(30, response.getQueries().getAccelerateSeconds());
    }

    @Test
    @DisplayName("Error object becomes a remote service error with its code")
    void testDecodeErrorObject() {
        RemoteServiceException e = assertThrows(RemoteServiceException.class, () -> JsonRpcCodec.decodeResult(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32001,\"message\":\"Node Invalid\"}}",
                ConfigResponse.class));

        assertEquals(-32001, e.getCode());
        assertTrue(e.getMessage().contains("Node Invalid"));
    }

    @Test
    @DisplayName("Garbage bodies and results are decode errors")
    void testDecodeGarbage() {
        assertThrows(ResponseDecodeException.class,
                () -> JsonRpcCodec.decodeResult("<html>oops</html>", ConfigResponse.class));
        assertThrows(ResponseDecodeException.class,
                () -> JsonRpcCodec.decodeResult("{\"jsonrpc\":\"2.0\",\"result\":[1,2]}", ConfigResponse.class));
        assertThrows(ResponseDecodeException.class,
                () -> JsonRpcCodec.decodeResult("{\"jsonrpc\":\"2.0\"}", ConfigResponse.class));
    }
}
