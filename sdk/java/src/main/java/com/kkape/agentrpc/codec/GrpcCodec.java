package com.kkape.agentrpc.codec;

import com.kkape.agentrpc.message.ConfigResponse;
import com.kkape.agentrpc.message.EnrollmentRequest;
import com.kkape.agentrpc.message.EnrollmentResponse;
import com.kkape.agentrpc.message.HealthCheckResponse;
import com.kkape.agentrpc.message.LogCollection;
import com.kkape.agentrpc.message.NodeKeyRequest;
import com.kkape.agentrpc.message.PublishResponse;
import com.kkape.agentrpc.message.QueryCollectionResponse;
import com.kkape.agentrpc.message.ResultCollection;
import com.kkape.agentrpc.model.DistributedQueries;
import com.kkape.agentrpc.model.EnrollmentDetails;
import com.kkape.agentrpc.model.QueryResult;
import com.kkape.agentrpc.proto.KolideAgentProto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between the logical messages and the kolide.agent protobuf schema.
 *
 * <p>The client uses the encode-request / decode-response half, the server the other
 * half. Fields the schema has no room for are dropped: discovery queries and query
 * stats do not travel over gRPC.</p>
 */
public final class GrpcCodec {

    private GrpcCodec() {
    }

    // Enrollment

    public static KolideAgentProto.EnrollmentRequest encodeEnrollmentRequest(EnrollmentRequest request) {
        EnrollmentDetails details = request.getEnrollmentDetails();
        KolideAgentProto.EnrollmentDetails protoDetails = KolideAgentProto.EnrollmentDetails.newBuilder()
                .setOsVersion(details.getOsVersion())
                .setOsBuild(details.getOsBuild())
                .setOsPlatform(details.getOsPlatform())
                .setHostname(details.getHostname())
                .setHardwareVendor(details.getHardwareVendor())
                .setHardwareModel(details.getHardwareModel())
                .setHardwareSerial(details.getHardwareSerial())
                .setOsqueryVersion(details.getOsqueryVersion())
                .setLauncherVersion(details.getLauncherVersion())
                .setOsName(details.getOsName())
                .setOsPlatformLike(details.getOsPlatformLike())
                .build();

        return KolideAgentProto.EnrollmentRequest.newBuilder()
                .setEnrollSecret(nullToEmpty(request.getEnrollSecret()))
                .setHostIdentifier(nullToEmpty(request.getHostIdentifier()))
                .setEnrollmentDetails(protoDetails)
                .build();
    }

    public static EnrollmentRequest decodeEnrollmentRequest(KolideAgentProto.EnrollmentRequest request) {
        KolideAgentProto.EnrollmentDetails protoDetails = request.getEnrollmentDetails();
        EnrollmentDetails details = EnrollmentDetails.builder()
                .osVersion(protoDetails.getOsVersion())
                .osBuild(protoDetails.getOsBuild())
                .osPlatform(protoDetails.getOsPlatform())
                .hostname(protoDetails.getHostname())
                .hardwareVendor(protoDetails.getHardwareVendor())
                .hardwareModel(protoDetails.getHardwareModel())
                .hardwareSerial(protoDetails.getHardwareSerial())
                .osqueryVersion(protoDetails.getOsqueryVersion())
                .launcherVersion(protoDetails.getLauncherVersion())
                .osName(protoDetails.getOsName())
                .osPlatformLike(protoDetails.getOsPlatformLike())
                .build();
        return new EnrollmentRequest(request.getEnrollSecret(), request.getHostIdentifier(), details);
    }

    public static EnrollmentResponse decodeEnrollmentResponse(KolideAgentProto.EnrollmentResponse response) {
        EnrollmentResponse decoded = new EnrollmentResponse();
        decoded.setNodeKey(response.getNodeKey());
        decoded.setNodeInvalid(response.getNodeInvalid());
        decoded.setDisableDevice(response.getDisableDevice());
        return decoded;
    }

    public static KolideAgentProto.EnrollmentResponse encodeEnrollmentResponse(EnrollmentResponse response) {
        return KolideAgentProto.EnrollmentResponse.newBuilder()
                .setNodeKey(nullToEmpty(response.getNodeKey()))
                .setNodeInvalid(response.isNodeInvalid())
                .setDisableDevice(response.isDisableDevice())
                .build();
    }

    // Node key requests: config, queries, health

    public static KolideAgentProto.AgentApiRequest encodeNodeKeyRequest(NodeKeyRequest request) {
        return KolideAgentProto.AgentApiRequest.newBuilder()
                .setNodeKey(request.getNodeKey())
                .build();
    }

    public static NodeKeyRequest decodeNodeKeyRequest(KolideAgentProto.AgentApiRequest request) {
        return new NodeKeyRequest(request.getNodeKey());
    }

    // Config

    public static ConfigResponse decodeConfigResponse(KolideAgentProto.ConfigResponse response) {
        ConfigResponse decoded = new ConfigResponse();
        decoded.setConfig(response.getConfigJsonBlob());
        decoded.setNodeInvalid(response.getNodeInvalid());
        decoded.setDisableDevice(response.getDisableDevice());
        return decoded;
    }

    public static KolideAgentProto.ConfigResponse encodeConfigResponse(ConfigResponse response) {
        return KolideAgentProto.ConfigResponse.newBuilder()
                .setConfigJsonBlob(nullToEmpty(response.getConfig()))
                .setNodeInvalid(response.isNodeInvalid())
                .setDisableDevice(response.isDisableDevice())
                .build();
    }

    // Logs

    public static KolideAgentProto.LogCollection encodeLogCollection(LogCollection collection) {
        KolideAgentProto.LogCollection.Builder builder = KolideAgentProto.LogCollection.newBuilder()
                .setNodeKey(collection.getNodeKey())
                .setLogType(LogTypes.toWire(collection.getLogType()));
        for (String log : collection.getLogs()) {
            builder.addLogs(KolideAgentProto.LogCollection.Log.newBuilder().setData(nullToEmpty(log)));
        }
        return builder.build();
    }

    public static LogCollection decodeLogCollection(KolideAgentProto.LogCollection collection) {
        List<String> logs = new ArrayList<>(collection.getLogsCount());
        for (KolideAgentProto.LogCollection.Log log : collection.getLogsList()) {
            logs.add(log.getData());
        }
        return new LogCollection(collection.getNodeKey(), LogTypes.fromWire(collection.getLogType()), logs);
    }

    // Publish acknowledgements

    public static PublishResponse decodePublishResponse(KolideAgentProto.AgentApiResponse response) {
        PublishResponse decoded = new PublishResponse();
        decoded.setMessage(response.getMessage());
        decoded.setErrorCode(response.getErrorCode());
        decoded.setNodeInvalid(response.getNodeInvalid());
        decoded.setDisableDevice(response.getDisableDevice());
        return decoded;
    }

    public static KolideAgentProto.AgentApiResponse encodePublishResponse(PublishResponse response) {
        return KolideAgentProto.AgentApiResponse.newBuilder()
                .setMessage(nullToEmpty(response.getMessage()))
                .setErrorCode(nullToEmpty(response.getErrorCode()))
                .setNodeInvalid(response.isNodeInvalid())
                .setDisableDevice(response.isDisableDevice())
                .build();
    }

    // Queries

    public static QueryCollectionResponse decodeQueryCollection(KolideAgentProto.QueryCollection collection) {
        DistributedQueries queries = new DistributedQueries();
        Map<String, String> byId = new LinkedHashMap<>();
        for (KolideAgentProto.QueryCollection.Query query : collection.getQueriesList()) {
            byId.put(query.getId(), query.getQuery());
        }
        queries.setQueries(byId);
        queries.setDiscovery(new LinkedHashMap<>());

        QueryCollectionResponse decoded = new QueryCollectionResponse();
        decoded.setQueries(queries);
        decoded.setNodeInvalid(collection.getNodeInvalid());
        decoded.setDisableDevice(collection.getDisableDevice());
        return decoded;
    }

    public static KolideAgentProto.QueryCollection encodeQueryCollection(QueryCollectionResponse response) {
        KolideAgentProto.QueryCollection.Builder builder = KolideAgentProto.QueryCollection.newBuilder()
                .setNodeInvalid(response.isNodeInvalid())
                .setDisableDevice(response.isDisableDevice());
        for (Map.Entry<String, String> entry : response.getQueries().getQueries().entrySet()) {
            builder.addQueries(KolideAgentProto.QueryCollection.Query.newBuilder()
                    .setId(entry.getKey())
                    .setQuery(nullToEmpty(entry.getValue())));
        }
        return builder.build();
    }

    // Results

    public static KolideAgentProto.ResultCollection encodeResultCollection(ResultCollection collection) {
        KolideAgentProto.ResultCollection.Builder builder = KolideAgentProto.ResultCollection.newBuilder()
                .setNodeKey(collection.getNodeKey());
        for (QueryResult result : collection.getResults()) {
            KolideAgentProto.ResultCollection.Result.Builder resultBuilder =
                    KolideAgentProto.ResultCollection.Result.newBuilder()
                            .setId(nullToEmpty(result.getQueryName()))
                            .setStatus(result.getStatus());
            for (Map<String, String> row : result.getRows()) {
                KolideAgentProto.ResultCollection.Result.ResultRow.Builder rowBuilder =
                        KolideAgentProto.ResultCollection.Result.ResultRow.newBuilder();
                for (Map.Entry<String, String> column : row.entrySet()) {
                    rowBuilder.addColumns(KolideAgentProto.ResultCollection.Result.ResultRow.Column.newBuilder()
                            .setName(column.getKey())
                            .setValue(nullToEmpty(column.getValue())));
                }
                resultBuilder.addRows(rowBuilder);
            }
            builder.addResults(resultBuilder);
        }
        return builder.build();
    }

    public static ResultCollection decodeResultCollection(KolideAgentProto.ResultCollection collection) {
        List<QueryResult> results = new ArrayList<>(collection.getResultsCount());
        for (KolideAgentProto.ResultCollection.Result result : collection.getResultsList()) {
            List<Map<String, String>> rows = new ArrayList<>(result.getRowsCount());
            for (KolideAgentProto.ResultCollection.Result.ResultRow row : result.getRowsList()) {
                Map<String, String> columns = new LinkedHashMap<>();
                for (KolideAgentProto.ResultCollection.Result.ResultRow.Column column : row.getColumnsList()) {
                    columns.put(column.getName(), column.getValue());
                }
                rows.add(columns);
            }
            results.add(new QueryResult(result.getId(), result.getStatus(), rows));
        }
        return new ResultCollection(collection.getNodeKey(), results);
    }

    // Health

    public static HealthCheckResponse decodeHealthCheckResponse(KolideAgentProto.HealthCheckResponse response) {
        HealthCheckResponse decoded = new HealthCheckResponse();
        decoded.setStatus(response.getStatusValue());
        decoded.setDisableDevice(response.getDisableDevice());
        return decoded;
    }

    public static KolideAgentProto.HealthCheckResponse encodeHealthCheckResponse(HealthCheckResponse response) {
        return KolideAgentProto.HealthCheckResponse.newBuilder()
                .setStatusValue(response.getStatus())
                .setDisableDevice(response.isDisableDevice())
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
