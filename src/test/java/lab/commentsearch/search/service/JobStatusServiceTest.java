package lab.commentsearch.search.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.domain.CommentSearchStatus;
import lab.commentsearch.search.dto.CommentSearchJobView;
import org.junit.jupiter.api.Test;

class JobStatusServiceTest {

    private final JobStore jobStore = mock(JobStore.class);
    private final JobStatusService statusService = new JobStatusService(jobStore, new MatchesJsonCodec(new ObjectMapper()));

    @Test
    void unreadableMatchesStillReportStatusAndResult() {
        UUID id = UUID.randomUUID();
        CommentSearchJob job = completedJob(id, "{not a list");
        when(jobStore.get(id)).thenReturn(Optional.of(job));

        CommentSearchJobView view = statusService.getStatus(id).orElseThrow();

        assertEquals(CommentSearchStatus.COMPLETED, view.status());
        assertEquals(2, view.result().commentCount());
        assertTrue(view.result().emailSent());
        assertNull(view.matches());
    }

    @Test
    void storedMatchesAreDecoded() {
        UUID id = UUID.randomUUID();
        String json = "[{\"text\":\"great\",\"author\":\"Ann\",\"likes\":1,\"published_time\":null,"
                + "\"link\":\"https://youtu.be/x\",\"timestamps\":[]}]";
        CommentSearchJob job = completedJob(id, json);
        when(jobStore.get(id)).thenReturn(Optional.of(job));

        CommentSearchJobView view = statusService.getStatus(id).orElseThrow();

        assertEquals(1, view.matches().size());
        assertEquals("Ann", view.matches().get(0).author());
    }

    private static CommentSearchJob completedJob(UUID id, String matchesJson) {
        CommentSearchJob job = mock(CommentSearchJob.class);
        Instant submitted = Instant.parse("2024-05-01T10:00:00Z");
        when(job.getId()).thenReturn(id);
        when(job.getVideoUrl()).thenReturn("https://youtu.be/x");
        when(job.getPhrases()).thenReturn(List.of("great"));
        when(job.getEmail()).thenReturn("a@b.com");
        when(job.getStatus()).thenReturn(CommentSearchStatus.COMPLETED);
        when(job.getSubmittedAt()).thenReturn(submitted);
        when(job.getCompletedAt()).thenReturn(submitted.plusSeconds(3));
        when(job.getCommentCount()).thenReturn(2);
        when(job.getScannedCount()).thenReturn(5);
        when(job.getEmailSent()).thenReturn(true);
        when(job.getMatchesJson()).thenReturn(matchesJson);
        return job;
    }
}
