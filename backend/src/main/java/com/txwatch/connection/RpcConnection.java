package com.txwatch.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txwatch.connection.model.AccountInfo;
import com.txwatch.connection.model.SignatureStatus;
import com.txwatch.connection.model.TransactionDetail;
import com.txwatch.connection.solana.SolanaRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed handle on one JSON-RPC endpoint. Every method is a single blocking request bounded by the
 * per-call timeout; no retries and no statistics here (see {@link ConnectionManager}).
 */
public class RpcConnection {

    private final SolanaRpcClient rpcClient;
    private final String endpoint;
    private final Commitment commitment;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;

    public RpcConnection(SolanaRpcClient rpcClient,
                         String endpoint,
                         Commitment commitment,
                         Duration timeout,
                         ObjectMapper objectMapper,
                         RateLimiter rateLimiter) {
        this.rpcClient = rpcClient;
        this.endpoint = endpoint;
        this.commitment = commitment != null ? commitment : Commitment.CONFIRMED;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
    }

    public long getSlot() {
        return call("getSlot", List.of(commitmentConfig())).asLong();
    }

    public long getBlockHeight() {
        return call("getBlockHeight", List.of(commitmentConfig())).asLong();
    }

    /** Native balance in lamports. */
    public long getBalance(String address) {
        return call("getBalance", List.of(address, commitmentConfig())).path("value").asLong();
    }

    public Optional<AccountInfo> getAccountInfo(String address) {
        Map<String, Object> config = commitmentConfig();
        config.put("encoding", "base64");
        JsonNode value = call("getAccountInfo", List.of(address, config)).path("value");
        if (value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(toAccountInfo(address, value));
    }

    /**
     * @param filters raw getProgramAccounts filter objects (dataSize, memcmp)
     */
    public List<AccountInfo> getProgramAccounts(String programId, List<Map<String, Object>> filters) {
        Map<String, Object> config = commitmentConfig();
        config.put("encoding", "base64");
        if (filters != null && !filters.isEmpty()) {
            config.put("filters", filters);
        }
        JsonNode result = call("getProgramAccounts", List.of(programId, config));
        if (!result.isArray()) {
            return List.of();
        }
        List<AccountInfo> accounts = new ArrayList<>();
        for (JsonNode item : result) {
            accounts.add(toAccountInfo(item.path("pubkey").asText(), item.path("account")));
        }
        return accounts;
    }

    /**
     * Status of one signature from the node's recent status cache; empty when the node has no record yet.
     */
    public Optional<SignatureStatus> getSignatureStatus(String signature) {
        JsonNode value = call("getSignatureStatuses",
                List.of(List.of(signature), Map.of("searchTransactionHistory", false))).path("value");
        if (!value.isArray() || value.isEmpty()) {
            return Optional.empty();
        }
        JsonNode status = value.get(0);
        if (status == null || status.isNull()) {
            return Optional.empty();
        }
        JsonNode err = status.path("err");
        JsonNode confirmations = status.path("confirmations");
        return Optional.of(new SignatureStatus(
                status.path("slot").asLong(),
                confirmations.isNumber() ? confirmations.asInt() : null,
                errorText(err),
                status.path("confirmationStatus").isTextual() ? status.path("confirmationStatus").asText() : null));
    }

    public Optional<TransactionDetail> getTransaction(String signature) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("encoding", "json");
        config.put("commitment", Commitment.CONFIRMED.rpcValue());
        config.put("maxSupportedTransactionVersion", 0);
        JsonNode result = call("getTransaction", List.of(signature, config));
        if (result.isNull() || result.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode meta = result.path("meta");
        List<String> logs = null;
        if (meta.path("logMessages").isArray()) {
            logs = new ArrayList<>();
            for (JsonNode line : meta.path("logMessages")) {
                logs.add(line.asText());
            }
        }
        return Optional.of(new TransactionDetail(
                result.path("slot").asLong(),
                result.path("blockTime").isNumber() ? result.path("blockTime").asLong() : null,
                meta.path("fee").isNumber() ? meta.path("fee").asLong() : null,
                longs(meta.path("preBalances")),
                longs(meta.path("postBalances")),
                logs));
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Commitment getCommitment() {
        return commitment;
    }

    private JsonNode call(String method, Object params) {
        String json;
        try {
            if (rateLimiter != null) {
                RateLimiter.waitForPermission(rateLimiter);
            }
            json = rpcClient.call(endpoint, method, params).block(timeout);
        } catch (RpcException e) {
            throw e;
        } catch (RequestNotPermitted e) {
            throw new RpcException(method + " rate limited: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new RpcException(method + " failed: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new RpcException(method + " returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException(method + " returned malformed JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }

    private Map<String, Object> commitmentConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("commitment", commitment.rpcValue());
        return config;
    }

    private static AccountInfo toAccountInfo(String address, JsonNode account) {
        byte[] data = null;
        JsonNode dataNode = account.path("data");
        if (dataNode.isArray() && dataNode.size() > 0 && dataNode.get(0).isTextual()) {
            data = Base64.getDecoder().decode(dataNode.get(0).asText());
        }
        return new AccountInfo(
                address,
                account.path("lamports").asLong(),
                account.path("owner").asText(null),
                account.path("executable").asBoolean(false),
                account.path("rentEpoch").asLong(0L),
                data);
    }

    /** Node error as text: plain strings unquoted, structured errors as compact JSON. */
    private static String errorText(JsonNode err) {
        if (err.isMissingNode() || err.isNull()) {
            return null;
        }
        return err.isTextual() ? err.asText() : err.toString();
    }

    private static List<Long> longs(JsonNode array) {
        if (!array.isArray()) {
            return List.of();
        }
        List<Long> values = new ArrayList<>(array.size());
        for (JsonNode n : array) {
            values.add(n.asLong());
        }
        return values;
    }
}
