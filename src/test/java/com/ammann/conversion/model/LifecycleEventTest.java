package com.ammann.conversion.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.conversion.enumeration.EventKind;
import com.ammann.conversion.enumeration.FailureKind;
import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.enumeration.JobStatus;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LifecycleEvent")
class LifecycleEventTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant UPDATED = Instant.parse("2026-03-01T10:00:05Z");
    private static final ConversionPath PATH =
            new ConversionPath(Format.MARKDOWN, Format.HTML, List.of(FormatPair.of(Format.MARKDOWN, Format.HTML)));

    @Test
    @DisplayName("should describe the path when a job starts running")
    void shouldDescribeRunningJob() {
        LifecycleEvent event = LifecycleEvent.forJob(snapshot(JobStatus.RUNNING, null, null));

        assertThat(event.kind()).isEqualTo(EventKind.JOB_RUNNING);
        assertThat(event.timestamp()).isEqualTo(UPDATED);
        assertThat(event.payload())
                .containsEntry("path", "markdown->html")
                .containsEntry("hops", 1)
                .containsEntry("completedHops", 0)
                .containsEntry("progress", 0.0);
    }

    @Test
    @DisplayName("should report the progress of a job between hops")
    void shouldReportProgressBetweenHops() {
        ConversionPath threeHops = new ConversionPath(
                Format.MARKDOWN,
                Format.PDF,
                List.of(
                        FormatPair.of(Format.MARKDOWN, Format.TEXT),
                        FormatPair.of(Format.TEXT, Format.HTML),
                        FormatPair.of(Format.HTML, Format.PDF)));
        JobSnapshot job = new JobSnapshot(
                UUID.randomUUID(), Format.MARKDOWN, Format.PDF, JobStatus.RUNNING, threeHops, 2, 10,
                null, null, CREATED, UPDATED, CREATED, null);

        LifecycleEvent event = LifecycleEvent.forJob(job);

        assertThat(event.kind()).isEqualTo(EventKind.JOB_RUNNING);
        assertThat(event.payload()).containsEntry("hops", 3).containsEntry("completedHops", 2);
        assertThat((Double) event.payload().get("progress")).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    @DisplayName("should carry the result size of a completed job")
    void shouldDescribeCompletedJob() {
        ConversionResult result = new ConversionResult(Format.HTML, "<p>x</p>".getBytes(StandardCharsets.UTF_8));

        LifecycleEvent event = LifecycleEvent.forJob(snapshot(JobStatus.COMPLETED, result, null));

        assertThat(event.kind()).isEqualTo(EventKind.JOB_COMPLETED);
        assertThat(event.payload()).containsEntry("contentType", "text/html").containsEntry("resultSize", 8);
    }

    @Test
    @DisplayName("should carry the error of a failed job")
    void shouldDescribeFailedJob() {
        ConversionError error = new ConversionError(FailureKind.TIMEOUT, "too slow");

        LifecycleEvent event = LifecycleEvent.forJob(snapshot(JobStatus.FAILED, null, error));

        assertThat(event.kind()).isEqualTo(EventKind.JOB_FAILED);
        assertThat(event.payload()).containsEntry("errorKind", "timeout").containsEntry("message", "too slow");
    }

    @Test
    @DisplayName("should build heartbeats without a job")
    void shouldBuildHeartbeat() {
        LifecycleEvent heartbeat = LifecycleEvent.heartbeat(UPDATED, 3);

        assertThat(heartbeat.jobId()).isNull();
        assertThat(heartbeat.kind()).isEqualTo(EventKind.HEARTBEAT);
        assertThat(heartbeat.payload()).containsEntry("subscribers", 3);
    }

    private static JobSnapshot snapshot(JobStatus status, ConversionResult result, ConversionError error) {
        return new JobSnapshot(
                UUID.randomUUID(), Format.MARKDOWN, Format.HTML, status, PATH,
                status == JobStatus.COMPLETED ? 1 : 0, 10,
                result, error, CREATED, UPDATED, CREATED, status.isTerminal() ? UPDATED : null);
    }
}
