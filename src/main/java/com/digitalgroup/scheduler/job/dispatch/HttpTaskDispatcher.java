package com.digitalgroup.scheduler.job.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches fired tasks as HTTP POST requests on a bounded worker pool.
 *
 * Pending requests wait in a bounded buffer. When both the workers and the buffer are full the
 * oldest pending request is dropped (its future completes with {@link DispatchResult.Outcome#DROPPED})
 * so that {@link #enqueue} never blocks the caller.
 */
@Slf4j
@Service
public class HttpTaskDispatcher implements TaskDispatcher {

    public static final String SECRET_KEY_HEADER = "X-Secret-Key-Id";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ThreadPoolExecutor executor;

    public HttpTaskDispatcher(RestTemplateBuilder restTemplateBuilder,
                              ObjectMapper objectMapper,
                              Clock clock,
                              @Value("${scheduler.dispatch.pool-size:4}") int poolSize,
                              @Value("${scheduler.dispatch.queue-capacity:100}") int queueCapacity,
                              @Value("${scheduler.dispatch.connect-timeout:PT5S}") Duration connectTimeout,
                              @Value("${scheduler.dispatch.read-timeout:PT30S}") Duration readTimeout) {
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
        this.objectMapper = objectMapper;
        this.clock = clock;

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "task-dispatch-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                this::dropOldest);
        log.info("HttpTaskDispatcher initialized with {} workers, queue capacity {}, read timeout {}",
                poolSize, queueCapacity, readTimeout);
    }

    @Override
    public CompletableFuture<DispatchResult> enqueue(DispatchRequest request) {
        DispatchJob job = new DispatchJob(request);
        executor.execute(job);
        log.debug("Enqueued dispatch of task {} to {}", request.taskId(), request.targetUrl());
        return job.future;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HttpTaskDispatcher shutdown complete");
    }

    RestTemplate getRestTemplate() {
        return restTemplate;
    }

    /**
     * Sends a single POST for the request. Never throws.
     */
    DispatchResult send(DispatchRequest request) {
        String taskId = request.taskId();
        try {
            HttpEntity<byte[]> entity = new HttpEntity<>(encodeBody(request), buildHeaders(request));
            log.info("Sending post request for task {} to {}", taskId, request.targetUrl());

            ResponseEntity<String> response = restTemplate.exchange(
                    request.targetUrl(), HttpMethod.POST, entity, String.class);

            int status = response.getStatusCode().value();
            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("Task {} dispatched to {}: {}", taskId, request.targetUrl(), status);
                return DispatchResult.succeeded(taskId, status, clock.instant());
            }
            log.warn("Task {} dispatch to {} returned {}", taskId, request.targetUrl(), status);
            return DispatchResult.httpError(taskId, status, response.getBody(), clock.instant());

        } catch (HttpStatusCodeException e) {
            log.warn("Task {} dispatch to {} returned {}: {}",
                    taskId, request.targetUrl(), e.getStatusCode().value(), e.getResponseBodyAsString());
            return DispatchResult.httpError(taskId, e.getStatusCode().value(), e.getResponseBodyAsString(),
                    clock.instant());
        } catch (RestClientException | IllegalArgumentException e) {
            log.error("Task {} dispatch to {} failed: {}", taskId, request.targetUrl(), e.getMessage());
            return DispatchResult.transportError(taskId, e.getMessage(), clock.instant());
        } catch (JsonProcessingException e) {
            log.error("Task {} payload could not be serialized: {}", taskId, e.getMessage());
            return DispatchResult.transportError(taskId, "Unserializable payload: " + e.getOriginalMessage(),
                    clock.instant());
        }
    }

    private HttpHeaders buildHeaders(DispatchRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(request.contentType()));
        if (StringUtils.hasText(request.authorization())) {
            headers.set(HttpHeaders.AUTHORIZATION, request.authorization());
        }
        if (StringUtils.hasText(request.secretRef())) {
            headers.set(SECRET_KEY_HEADER, request.secretRef());
        }
        return headers;
    }

    /**
     * JSON for JSON content types, form encoding for everything else.
     */
    private byte[] encodeBody(DispatchRequest request) throws JsonProcessingException {
        MediaType mediaType = MediaType.parseMediaType(request.contentType());
        if (MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)) {
            return objectMapper.writeValueAsBytes(request.payload());
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        for (Map.Entry<String, Object> entry : request.payload().entrySet()) {
            form.add(entry.getKey(), entry.getValue() != null ? String.valueOf(entry.getValue()) : "");
        }
        String encoded = UriComponentsBuilder.newInstance().queryParams(form).encode().build().getQuery();
        return (encoded != null ? encoded : "").getBytes(StandardCharsets.UTF_8);
    }

    private void dropOldest(Runnable rejected, ThreadPoolExecutor pool) {
        if (pool.isShutdown()) {
            ((DispatchJob) rejected).drop("dispatcher is shut down");
            return;
        }
        Runnable oldest = pool.getQueue().poll();
        if (oldest instanceof DispatchJob job) {
            job.drop("dispatch queue full");
        }
        pool.execute(rejected);
    }

    private final class DispatchJob implements Runnable {

        private final DispatchRequest request;
        private final CompletableFuture<DispatchResult> future = new CompletableFuture<>();

        private DispatchJob(DispatchRequest request) {
            this.request = request;
        }

        @Override
        public void run() {
            future.complete(send(request));
        }

        private void drop(String reason) {
            log.warn("Dropped dispatch of task {} to {}: {}", request.taskId(), request.targetUrl(), reason);
            future.complete(DispatchResult.dropped(request.taskId(), reason, clock.instant()));
        }
    }
}
