package io.github.koszti.bigq.bigquery;

import com.google.auth.Credentials;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adds the credentials' request metadata (the bearer token, refreshed as needed) to each call.
 */
public class GoogleCredentialsInterceptor implements ClientHttpRequestInterceptor
{
    private final Credentials credentials;

    public GoogleCredentialsInterceptor(Credentials credentials) {
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        Map<String, List<String>> metadata = credentials.getRequestMetadata(request.getURI());
        if (metadata != null) {
            metadata.forEach((name, values) -> request.getHeaders().put(name, values));
        }
        return execution.execute(request, body);
    }
}
