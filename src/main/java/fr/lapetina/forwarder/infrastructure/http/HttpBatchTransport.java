package fr.lapetina.forwarder.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.forwarder.domain.model.TransactionBatch;
import fr.lapetina.forwarder.worker.BatchTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * {@link BatchTransport} posting each batch as JSON to {@code http://<host>:<port>/<path>}.
 *
 * Uses java.net.http.HttpClient in blocking mode: every call runs on the
 * destination's own worker thread.
 */
public class HttpBatchTransport implements BatchTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpBatchTransport.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final String path;

    public HttpBatchTransport(Duration connectTimeout, Duration requestTimeout, String path) {
        this.requestTimeout = requestTimeout;
        this.path = path.startsWith("/") ? path.substring(1) : path;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void send(InetSocketAddress destination, TransactionBatch batch) throws IOException {
        URI uri = buildUri(destination);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(buildRequestBody(batch)))
                .build();

        Instant startTime = Instant.now();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted sending batch to " + uri);
            interrupted.initCause(e);
            throw interrupted;
        }

        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            log.debug("Batch rejected: destination={}, status={}, latencyMs={}", destination, statusCode, latencyMs);
            throw new IOException("Destination " + destination + " rejected batch with HTTP " + statusCode);
        }
        log.debug("Batch sent: destination={}, size={}, latencyMs={}", destination, batch.size(), latencyMs);
    }

    URI buildUri(InetSocketAddress destination) {
        String host = destination.getHostString();
        if (host.contains(":")) {
            host = "[" + host + "]";
        }
        return URI.create("http://" + host + ":" + destination.getPort() + "/" + path);
    }

    byte[] buildRequestBody(TransactionBatch batch) throws IOException {
        // byte[] elements serialize as base64 strings
        return objectMapper.writeValueAsBytes(new BatchPayload(batch.wiredTransactions(), batch.createdAt()));
    }

    private record BatchPayload(List<byte[]> transactions, Instant createdAt) {
    }
}
