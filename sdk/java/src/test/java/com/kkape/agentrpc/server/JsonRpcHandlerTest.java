package com.kkape.agentrpc.server;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.kkape.agentrpc.StubService;
import com.kkape.agentrpc.codec.JsonRpcError;
import com.kkape.agentrpc.error.DeviceDisabledException;
import com.kkape.agentrpc.error.NodeInvalidException;
import com.kkape.agentrpc.error.RemoteServiceException;
import com.kkape.agentrpc.model.ConfigResult;
import com.kkape.agentrpc.model.LogType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRpcHandlerTest {

    private static JsonObject call(StubService service, String body) {
        return JsonParser.parseString(new JsonRpcHandler(service).handleMessage(body)).getAsJsonObject();
    }

    private static String request(String method, String params) {
        return "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"" + method + "\",\"params\":" + params + "}";
    }

    private static int errorCode(JsonObject response) {
        return response.getAsJsonObject("error").get("code").getAsInt();
    }

    @Test
    @DisplayName("Config request returns the service result and echoes the id")
    void testRequestConfig() {
        JsonObject response = call(new StubService().config("{\"a\":1}"),
                request("RequestConfig", "{\"node_key\":\"nk\"}"));

        assertEquals(7, response.get("id").getAsInt());
        assertEquals("2.0", response.get("jsonrpc").getAsString());
        JsonObject result = response.getAsJsonObject("result");
        assertEquals("{\"a\":1}", result.get("config").getAsString());
        assertFalse(result.get("node_invalid").getAsBoolean());
    }

    @Test
    @DisplayName("Enrollment params are decoded including host details")
    void testRequestEnrollment() {
        StubService service = new StubService();
        JsonObject response = call(service, request("RequestEnrollment",
                "{\"enroll_secret\":\"s3cret\",\"host_identifier\":\"h\","
                        + "\"EnrollmentDetails\":{\"hostname\":\"box\",\"os_platform\":\"darwin\"}}"));

        assertEquals("node-key-1", response.getAsJsonObject("result").get("node_key").getAsString());
        assertEquals("s3cret", service.lastEnrollSecret);
        assertEquals("box", service.lastDetails.getHostname());
        assertEquals("darwin", service.lastDetails.getOsPlatform());
    }

    @Test
    @DisplayName("Log types travel as integer codes")
    void testPublishLogs() {
        StubService service = new StubService();
        call(service, request("PublishLogs", "{\"node_key\":\"nk\",\"LogType\":4,\"Logs\":[\"a\",\"b\"]}"));

        assertEquals(LogType.STATUS, service.lastLogType);
        assertEquals(List.of("a", "b"), service.lastLogs);
    }

    @Test
    @DisplayName("Node invalid maps to its dedicated code")
    void testNodeInvalid() {
        JsonObject response = call(new StubService().failWith(new NodeInvalidException("bad key")),
                request("RequestQueries", "{\"node_key\":\"nk\"}"));

        assertEquals(JsonRpcError.NODE_INVALID, errorCode(response));
        assertEquals(ServerErrors.NODE_INVALID_MESSAGE,
                response.getAsJsonObject("error").get("message").getAsString());
    }

    @Test
    @DisplayName("Other service failures are generic server errors")
    void testServerError() {
        JsonObject response = call(new StubService().failWith(new RemoteServiceException(1, "database is down")),
                request("RequestConfig", "{\"node_key\":\"nk\"}"));

        assertEquals(JsonRpcError.INTERNAL_ERROR, errorCode(response));
        assertFalse(response.toString().contains("database is down"));
    }

    @Test
    @DisplayName("Device disabled answers with the disable flag")
    void testDeviceDisabled() {
        JsonObject response = call(new StubService().failWith(new DeviceDisabledException()),
                request("CheckHealth", "{}"));

        assertTrue(response.getAsJsonObject("result").get("disable_device").getAsBoolean());
        assertFalse(response.has("error") && !response.get("error").isJsonNull());
    }

    @Test
    @DisplayName("Undecodable params, envelopes, versions and methods get distinct codes")
    void testProtocolErrors() {
        StubService service = new StubService();

        JsonObject badParams = call(service, request("PublishLogs", "{\"LogType\":99}"));
        assertEquals(JsonRpcError.DECODE_FAILED, errorCode(badParams));
        assertTrue(badParams.getAsJsonObject("error").get("message").getAsString()
                .startsWith("couldn't unmarshal body to log collection request"));

        assertEquals(JsonRpcError.DECODE_FAILED, errorCode(call(service, request("RequestConfig", "null"))));
        assertEquals(JsonRpcError.PARSE_ERROR, errorCode(call(service, "{not json")));
        assertEquals(JsonRpcError.INVALID_REQUEST,
                errorCode(call(service, "{\"jsonrpc\":\"1.0\",\"id\":1,\"method\":\"CheckHealth\"}")));
        assertEquals(JsonRpcError.METHOD_NOT_FOUND, errorCode(call(service, request("Shutdown", "{}"))));
    }

    @Test
    @DisplayName("An unexpected service failure answers with a generic server error")
    void testRuntimeFailureIsServerError() {
        StubService service = new StubService() {
            @Override
            public ConfigResult requestConfig(String nodeKey) {
                throw new IllegalStateException("db password=hunter2");
            }
        };
        String body = new JsonRpcHandler(service).handleMessage(request("RequestConfig", "{\"node_key\":\"nk\"}"));
        JsonObject response = JsonParser.parseString(body).getAsJsonObject();

        assertEquals(7, response.get("id").getAsInt());
        assertEquals(JsonRpcError.INTERNAL_ERROR, errorCode(response));
        assertEquals(ServerErrors.SERVER_ERROR_MESSAGE,
                response.getAsJsonObject("error").get("message").getAsString());
        assertFalse(body.contains("hunter2"));
    }
}
