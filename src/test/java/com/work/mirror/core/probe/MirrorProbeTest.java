package com.work.mirror.core.probe;

import com.work.mirror.core.model.ProbeResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class MirrorProbeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    public void ok_on_v2_is_available_and_root_not_tried() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(eq("https://m.example/v2/"), any())).thenReturn(200);

        ProbeResult r = new MirrorProbe(client).probe("https://m.example", TIMEOUT);

        assertTrue(r.isAvailable());
        assertEquals(MirrorProbe.LABEL_AVAILABLE, r.getStatusLabel());
        assertEquals(200, r.getStatusCode());
        assertEquals("https://m.example", r.getEndpoint());
        assertTrue(r.getResponseTimeMs() >= 0);
        assertNotNull(r.getObservedAt());
        verify(client, never()).fetchStatus(eq("https://m.example"), any());
    }

    @Test
    public void forbidden_status_is_available_with_auth_label() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(anyString(), any())).thenReturn(403);

        ProbeResult r = new MirrorProbe(client).probe("https://m.example", TIMEOUT);

        assertTrue(r.isAvailable());
        assertEquals(MirrorProbe.LABEL_AUTH_REQUIRED, r.getStatusLabel());
        assertEquals(403, r.getStatusCode());
    }

    @Test
    public void not_found_error_response_is_available_with_code_label() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(anyString(), any())).thenThrow(new HttpClientErrorException(HttpStatus.NOT_FOUND));

        ProbeResult r = new MirrorProbe(client).probe("https://m.example", TIMEOUT);

        assertTrue(r.isAvailable());
        assertEquals("available (HTTP 404)", r.getStatusLabel());
        assertEquals(404, r.getStatusCode());
    }

    @Test
    public void server_error_is_unavailable_and_returns_immediately() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(anyString(), any())).thenThrow(new HttpServerErrorException(HttpStatus.INTERNAL_SERVER_ERROR));

        ProbeResult r = new MirrorProbe(client).probe("https://m.example", TIMEOUT);

        assertFalse(r.isAvailable());
        assertEquals("HTTP error: 500", r.getStatusLabel());
        assertEquals(500, r.getStatusCode());
        verify(client, times(1)).fetchStatus(anyString(), any());
    }

    @Test
    public void connection_failure_falls_back_to_root_url() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(eq("https://m.example/v2/"), any())).thenThrow(new ResourceAccessException("refused"));
        when(client.fetchStatus(eq("https://m.example"), any())).thenReturn(301);

        ProbeResult r = new MirrorProbe(client).probe("https://m.example/", TIMEOUT);

        assertTrue(r.isAvailable());
        assertEquals(301, r.getStatusCode());
    }

    @Test
    public void all_variants_unreachable_is_connection_failed_with_zero_code() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(anyString(), any())).thenThrow(new ResourceAccessException("timeout"));

        ProbeResult r = new MirrorProbe(client).probe("https://dead.example", TIMEOUT);

        assertFalse(r.isAvailable());
        assertEquals(MirrorProbe.LABEL_CONNECTION_FAILED, r.getStatusLabel());
        assertEquals(0, r.getStatusCode());
        verify(client, times(2)).fetchStatus(anyString(), eq(TIMEOUT));
    }

    @Test
    public void unlisted_success_code_tries_next_variant() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(eq("https://m.example/v2/"), any())).thenReturn(204);
        when(client.fetchStatus(eq("https://m.example"), any())).thenReturn(204);

        ProbeResult r = new MirrorProbe(client).probe("https://m.example", TIMEOUT);

        assertFalse(r.isAvailable());
        assertEquals(MirrorProbe.LABEL_CONNECTION_FAILED, r.getStatusLabel());
    }

    @Test
    public void candidate_urls_trim_trailing_slashes() {
        assertEquals(Arrays.asList("https://m.example/v2/", "https://m.example"),
                MirrorProbe.candidateUrls("https://m.example//"));
    }

    @Test
    public void blank_endpoint_is_rejected() {
        MirrorProbe probe = new MirrorProbe(mock(MirrorClient.class));
        assertThrows(IllegalArgumentException.class, () -> probe.probe(" ", TIMEOUT));
    }
}
