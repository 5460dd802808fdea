package lending.settlement.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

// Minimal JSON-RPC 2.0 caller over RestClient, shared by the non-web3j clients.
public class JsonRpcClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String rpcUrl;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcClient(RestClient restClient, ObjectMapper objectMapper, String rpcUrl) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.rpcUrl = rpcUrl;
    }

    public JsonNode call(String method, List<?> params) {
        String responseBody = restClient.post()
                .uri(rpcUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                        "jsonrpc", "2.0",
                        "method", method,
                        "params", params,
                        "id", requestIds.incrementAndGet()
                ))
                .retrieve()
                .body(String.class);

        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse RPC response for " + method, e);
        }
        if (root == null) {
            throw new IllegalStateException("Empty RPC response for " + method);
        }

        JsonNode errorNode = root.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            throw new IllegalStateException("RPC error for " + method + ": " + errorNode);
        }

        JsonNode resultNode = root.get("result");
        if (resultNode == null || resultNode.isNull()) {
            throw new IllegalStateException("Invalid RPC response for " + method + ": missing result");
        }
        return resultNode;
    }
}
