package lab.commentsearch.search.api;

import java.util.UUID;
import lab.commentsearch.search.domain.SearchReport;
import lab.commentsearch.search.dto.CommentSearchJobView;
import lab.commentsearch.search.dto.SubmitRequest;
import lab.commentsearch.search.dto.SubmitResponse;
import lab.commentsearch.search.exception.JobNotFoundException;
import lab.commentsearch.search.service.CommentSearchService;
import lab.commentsearch.search.service.JobStatusService;
import lab.commentsearch.search.service.SearchReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class CommentSearchController {

    private static final Logger log = LoggerFactory.getLogger(CommentSearchController.class);
    private final CommentSearchService searchService;
    private final JobStatusService statusService;
    private final SearchReportService reportService;

    public CommentSearchController(CommentSearchService searchService,
                                   JobStatusService statusService,
                                   SearchReportService reportService) {
        this.searchService = searchService;
        this.statusService = statusService;
        this.reportService = reportService;
    }

    @PostMapping("/submit")
    public ResponseEntity<SubmitResponse> submit(@RequestBody SubmitRequest request) {
        UUID requestId = searchService.submit(request.videoUrl(), request.phrases(), request.email());
        return ResponseEntity.ok(SubmitResponse.accepted(requestId));
    }

    @GetMapping("/status/{requestId}")
    public ResponseEntity<CommentSearchJobView> status(@PathVariable String requestId) {
        log.debug("Status requested requestId={}", requestId);
        return statusService.getStatus(parseId(requestId))
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new JobNotFoundException(requestId));
    }

    @GetMapping("/report")
    public ResponseEntity<SearchReport> report() {
        return ResponseEntity.ok(reportService.report());
    }

    private static UUID parseId(String requestId) {
        try {
            return UUID.fromString(requestId);
        } catch (IllegalArgumentException ex) {
            throw new JobNotFoundException(requestId);
        }
    }
}
