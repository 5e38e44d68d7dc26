package co.fanki.zombies.analysis.application;

import co.fanki.zombies.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link AnalysisController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisControllerTest {

    @Test
    void whenStarting_givenGraph_shouldAccept() {
        final ReachabilityService service = createMock(
                ReachabilityService.class);
        expect(service.start()).andReturn(new CompletableFuture<>());
        replay(service);

        final ResponseEntity<?> response = new AnalysisController(service)
                .start();

        verify(service);
        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals(Map.of("running", true), response.getBody());
    }

    @Test
    void whenStarting_givenNoGraph_shouldReturnBadRequest() {
        final ReachabilityService service = createMock(
                ReachabilityService.class);
        expect(service.start()).andThrow(
                new DomainException("No graph", "GRAPH_NOT_BUILT"));
        replay(service);

        final ResponseEntity<?> response = new AnalysisController(service)
                .start();

        verify(service);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("GRAPH_NOT_BUILT",
                ((Map<?, ?>) response.getBody()).get("errorCode"));
    }

    @Test
    void whenReadingStatus_givenNoRun_shouldOnlyReportRunningFlag() {
        final ReachabilityService service = createMock(
                ReachabilityService.class);
        expect(service.isRunning()).andReturn(false);
        expect(service.latest()).andReturn(Optional.empty());
        replay(service);

        final ResponseEntity<Map<String, Object>> response =
                new AnalysisController(service).status();

        verify(service);
        assertEquals(Map.of("running", false), response.getBody());
    }

    @Test
    void whenCancelling_givenRunningAnalysis_shouldSignalIt() {
        final ReachabilityService service = createMock(
                ReachabilityService.class);
        expect(service.cancel()).andReturn(true);
        replay(service);

        final ResponseEntity<Map<String, Object>> response =
                new AnalysisController(service).cancel();

        verify(service);
        assertEquals(true, response.getBody().get("cancelled"));
    }

}
