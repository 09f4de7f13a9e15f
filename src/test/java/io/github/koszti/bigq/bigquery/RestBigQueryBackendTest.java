package io.github.koszti.bigq.bigquery;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.koszti.bigq.bigquery.exception.BigQueryBackendException;
import io.github.koszti.bigq.bigquery.exception.BigQueryRequestRejectedException;
import io.github.koszti.bigq.bigquery.exception.BigQueryUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestBigQueryBackendTest {

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private String startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/bigquery/v2";
    }

    private static BigQueryBackend backend(String baseUrl) throws Exception {
        return ClientOptions.newBuilder().baseUrl(baseUrl).build().createBackend();
    }

    @Test
    void submitQuerySendsDatasetAndLimitAndReadsFirstPage() throws Exception {
        AtomicReference<String> method = new AtomicReference<>();
        AtomicReference<String> body = new AtomicReference<>();
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/my-project/queries", exchange -> {
            method.set(exchange.getRequestMethod());
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, """
                    {
                      "kind": "bigquery#queryResponse",
                      "jobReference": {"projectId": "my-project", "jobId": "job_abc", "location": "US"},
                      "jobComplete": true,
                      "totalRows": "3",
                      "pageToken": "tok1",
                      "schema": {"fields": [{"name": "n", "type": "INTEGER", "mode": "NULLABLE"}]},
                      "rows": [{"f": [{"v": "1"}]}, {"f": [{"v": null}]}]
                    }
                    """);
        });
        server.start();

        SubmitResult result = backend(baseUrl).submitQuery("my-project", "my_dataset", "SELECT n FROM t", 2);

        assertEquals("POST", method.get());
        assertTrue(body.get().contains("\"query\":\"SELECT n FROM t\""));
        assertTrue(body.get().contains("\"datasetId\":\"my_dataset\""));
        assertTrue(body.get().contains("\"maxResults\":2"));
        assertFalse(body.get().contains("useLegacySql"));

        assertTrue(result.jobComplete());
        assertEquals("job_abc", result.jobId());
        RowPage page = result.firstPage();
        assertEquals(2, page.rows().size());
        assertEquals("1", page.rows().get(0).get(0));
        assertNull(page.rows().get(1).get(0));
        assertEquals("tok1", page.pageToken());
        assertEquals(3L, page.totalRows());
        assertEquals("INTEGER", page.schema().get(0).type());
    }

    @Test
    void submitQueryOmitsLimitWhenZeroAndReportsPendingJob() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/queries", exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, """
                    {"jobReference": {"projectId": "p", "jobId": "job_slow"}, "jobComplete": false}
                    """);
        });
        server.start();

        SubmitResult result = backend(baseUrl).submitQuery("p", "d", "SELECT 1", 0);

        assertFalse(body.get().contains("maxResults"));
        assertFalse(result.jobComplete());
        assertEquals("job_slow", result.jobId());
        assertNull(result.firstPage());
    }

    @Test
    void getJobStatusMapsStates() throws Exception {
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/jobs/pending", exchange ->
                respond(exchange, 200, "{\"status\": {\"state\": \"PENDING\"}}"));
        server.createContext("/bigquery/v2/projects/p/jobs/done", exchange ->
                respond(exchange, 200, "{\"status\": {\"state\": \"DONE\"}}"));
        server.createContext("/bigquery/v2/projects/p/jobs/failed", exchange ->
                respond(exchange, 200, """
                        {"status": {"state": "DONE", "errorResult": {"reason": "invalidQuery", "message": "Unrecognized name: foo"}}}
                        """));
        server.start();

        BigQueryBackend backend = backend(baseUrl);

        assertEquals(JobStatus.running(), backend.getJobStatus("p", "pending"));
        assertEquals(JobStatus.done(), backend.getJobStatus("p", "done"));
        JobStatus failed = backend.getJobStatus("p", "failed");
        assertTrue(failed.isFailed());
        assertEquals("Unrecognized name: foo", failed.errorMessage());
    }

    @Test
    void fetchResultsPageSendsStartIndexAndMaxResults() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/queries/job_1", exchange -> {
            query.set(exchange.getRequestURI().getQuery());
            respond(exchange, 200, """
                    {"jobComplete": true, "rows": [{"f": [{"v": "x"}, {"v": [{"v": "1"}, {"v": "2"}]}]}]}
                    """);
        });
        server.start();

        RowPage page = backend(baseUrl).fetchResultsPage("p", "job_1", 20, 10);

        assertTrue(query.get().contains("startIndex=20"));
        assertTrue(query.get().contains("maxResults=10"));
        assertFalse(page.hasMore());
        Row row = page.rows().get(0);
        assertEquals("x", row.get(0));
        assertTrue(row.get(1) instanceof List);
    }

    @Test
    void fetchResultsPageOmitsMaxResultsWhenZero() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/queries/job_1", exchange -> {
            query.set(exchange.getRequestURI().getQuery());
            respond(exchange, 200, "{\"jobComplete\": true}");
        });
        server.start();

        RowPage page = backend(baseUrl).fetchResultsPage("p", "job_1", 0, 0);

        assertEquals("startIndex=0", query.get());
        assertTrue(page.rows().isEmpty());
    }

    @Test
    void fetchResultsPageKeepsRowsWhenBigQueryReportsWarnings() throws Exception {
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/queries/job_1", exchange ->
                respond(exchange, 200, """
                        {
                          "jobComplete": true,
                          "rows": [{"f": [{"v": "x"}]}],
                          "errors": [{"reason": "warning", "message": "informational"}]
                        }
                        """));
        server.start();

        RowPage page = backend(baseUrl).fetchResultsPage("p", "job_1", 0, 0);

        assertEquals(1, page.rows().size());
        assertEquals("x", page.rows().get(0).get(0));
    }

    @Test
    void unreadableResponseIsNotReportedAsUnavailable() throws Exception {
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/jobs/job_1", exchange ->
                respond(exchange, 200, "{not json"));
        server.start();

        BigQueryBackendException e = assertThrows(BigQueryBackendException.class, () ->
                backend(baseUrl).getJobStatus("p", "job_1"));

        assertFalse(e instanceof BigQueryUnavailableException);
        assertTrue(e.getMessage().contains("Could not read BigQuery jobs.get response"));
    }

    @Test
    void sharedRestClientBuilderIsLeftUntouched() throws Exception {
        List<String> authorizations = new CopyOnWriteArrayList<>();
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/jobs/job_1", exchange -> {
            authorizations.add(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            respond(exchange, 200, "{\"status\": {\"state\": \"DONE\"}}");
        });
        server.start();

        AtomicInteger intercepted = new AtomicInteger();
        RestClient.Builder shared = RestClient.builder()
                .requestInterceptor((request, body, execution) -> {
                    intercepted.incrementAndGet();
                    return execution.execute(request, body);
                });
        ClientOptions options = ClientOptions.newBuilder()
                .baseUrl(baseUrl)
                .credentials(GoogleCredentials.create(new AccessToken("token-123", null)))
                .restClientBuilder(shared)
                .build();

        BigQueryBackend first = options.createBackend();
        options.createBackend();
        first.getJobStatus("p", "job_1");

        assertEquals(1, intercepted.get());
        assertEquals(List.of("Bearer token-123"), authorizations);

        shared.build().get().uri(baseUrl + "/projects/p/jobs/job_1").retrieve().toBodilessEntity();

        assertEquals(List.of("Bearer token-123", "null"), authorizations);
    }

    @Test
    void httpErrorBecomesRequestRejected() throws Exception {
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/queries", exchange ->
                respond(exchange, 400, """
                        {"error": {"code": 400, "message": "Syntax error: Unexpected keyword FORM"}}
                        """));
        server.start();

        BigQueryRequestRejectedException e = assertThrows(BigQueryRequestRejectedException.class, () ->
                backend(baseUrl).submitQuery("p", "d", "SELECT * FORM t", 0));

        assertEquals(400, e.getStatusCode());
        assertTrue(e.getMessage().contains("Unexpected keyword FORM"));
    }

    @Test
    void unreachableEndpointBecomesUnavailable() throws Exception {
        String baseUrl = startServer();
        server.start();
        server.stop(0);
        server = null;

        BigQueryUnavailableException e = assertThrows(BigQueryUnavailableException.class, () ->
                backend(baseUrl).getJobStatus("p", "job_1"));

        assertEquals(baseUrl, e.getBaseUrl());
    }

    @Test
    void credentialsAreSentAsBearerToken() throws Exception {
        AtomicReference<String> authorization = new AtomicReference<>();
        String baseUrl = startServer();
        server.createContext("/bigquery/v2/projects/p/jobs/job_1", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, "{\"status\": {\"state\": \"RUNNING\"}}");
        });
        server.start();

        BigQueryBackend backend = ClientOptions.newBuilder()
                .baseUrl(baseUrl)
                .credentials(GoogleCredentials.create(new AccessToken("token-123", null)))
                .build()
                .createBackend();
        backend.getJobStatus("p", "job_1");

        assertEquals("Bearer token-123", authorization.get());
    }

    private static void respond(HttpExchange exchange, int status, String body) {
        try {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } catch (Exception e) {
            throw new RuntimeException(e);
        } finally {
            exchange.close();
        }
    }
}
