/* (C)2026 */
package com.ammann.conversion.mcp;

import static com.ammann.conversion.support.TestSettings.settings;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.conversion.config.ConversionSettings;
import com.ammann.conversion.converter.ConverterRegistry;
import com.ammann.conversion.enumeration.JobStatus;
import com.ammann.conversion.graph.FormatGraph;
import com.ammann.conversion.service.ConversionEngine;
import com.ammann.conversion.service.EventBroadcaster;
import com.ammann.conversion.service.JobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConversionTools")
class ConversionToolsTest {

    private static final String STARTED = "Document conversion started. Job ID: ";

    private ExecutorService executor;
    private JobStore store;
    private ConversionTools tools;

    @BeforeEach
    void setUp() {
        ConversionSettings settings = settings().maxPayloadBytes(1024).build();
        ConverterRegistry registry = ConverterRegistry.defaults();
        executor = Executors.newFixedThreadPool(2);
        store = new JobStore(settings.retention(), Clock.systemUTC());
        ConversionEngine engine = new ConversionEngine(
                registry, FormatGraph.from(registry, settings.excludedEdges()), store,
                new EventBroadcaster(settings), executor, settings, null);
        ObjectMapper mapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        tools = new ConversionTools(engine, mapper);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("convert_document should start a job and report its id")
    void convertDocumentStartsJob() throws Exception {
        String answer = tools.convertDocument("markdown", "html", "# Hello");

        assertThat(answer).startsWith(STARTED);
        UUID id = UUID.fromString(answer.substring(STARTED.length()));
        assertThat(store.awaitTerminal(id).toCompletableFuture().get(10, TimeUnit.SECONDS).status())
                .isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("convert_document should explain rejected requests")
    void convertDocumentReportsErrors() {
        assertThat(tools.convertDocument("rtf", "html", "x")).startsWith("Error: ").contains("rtf");
        assertThat(tools.convertDocument("text", "html", "x".repeat(2000))).startsWith("Error: ");
        assertThat(tools.convertDocument("pdf", "text", "***not base64***")).startsWith("Error: ");
        assertThat(tools.convertDocument("text", "", "x")).startsWith("Error: ");
        assertThat(tools.convertDocument("text", "html", null)).isEqualTo("Error: content is required");
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("list_supported_formats should list formats and direct conversions")
    void listSupportedFormats() {
        String answer = tools.listSupportedFormats();

        assertThat(answer)
                .startsWith("Supported formats: text, markdown, html, pdf, docx")
                .contains("Direct conversions: ")
                .contains("markdown->html")
                .contains("pdf->text");
    }

    @Test
    @DisplayName("get_conversion_status should render the job as JSON")
    void getConversionStatusRendersJob() throws Exception {
        String started = tools.convertDocument("text", "html", "hello");
        UUID id = UUID.fromString(started.substring(STARTED.length()));
        store.awaitTerminal(id).toCompletableFuture().get(10, TimeUnit.SECONDS);

        String status = tools.getConversionStatus(id.toString());

        assertThat(status)
                .contains("\"jobId\" : \"" + id + "\"")
                .contains("\"status\" : \"completed\"")
                .contains("\"progress\" : 1.0")
                .contains("<p>hello</p>");
    }

    @Test
    @DisplayName("get_conversion_status should report unknown and malformed ids")
    void getConversionStatusReportsUnknownJobs() {
        assertThat(tools.getConversionStatus(UUID.randomUUID().toString()))
                .startsWith("Error: Conversion job not found");
        assertThat(tools.getConversionStatus("nope")).startsWith("Error: Conversion job not found");
        assertThat(tools.getConversionStatus(" ")).isEqualTo("Error: job_id is required");
    }
}
