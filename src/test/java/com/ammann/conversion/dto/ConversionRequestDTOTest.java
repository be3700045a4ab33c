package com.ammann.conversion.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.conversion.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConversionRequestDTO")
class ConversionRequestDTOTest {

    @Test
    @DisplayName("should encode text content as UTF-8")
    void shouldEncodeTextContent() {
        ConversionRequestDTO request = new ConversionRequestDTO("text", "html", "caf\u00E9", null);

        assertThat(request.payload()).isEqualTo("caf\u00E9".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should decode Base64 content, tolerating line breaks")
    void shouldDecodeBase64Content() {
        String encoded = Base64.getMimeEncoder().encodeToString(new byte[100]);

        ConversionRequestDTO request = new ConversionRequestDTO("pdf", "text", null, encoded);

        assertThat(request.payload()).hasSize(100);
    }

    @Test
    @DisplayName("should accept empty text content")
    void shouldAcceptEmptyContent() {
        assertThat(new ConversionRequestDTO("text", "html", "", null).payload()).isEmpty();
    }

    @Test
    @DisplayName("should require exactly one content field")
    void shouldRequireExactlyOneContent() {
        assertThatThrownBy(() -> new ConversionRequestDTO("text", "html", null, null).payload())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("required");
        assertThatThrownBy(() -> new ConversionRequestDTO("text", "html", "a", "YQ==").payload())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not both");
    }

    @Test
    @DisplayName("should reject invalid Base64")
    void shouldRejectInvalidBase64() {
        assertThatThrownBy(() -> new ConversionRequestDTO("pdf", "text", null, "***").payload())
                .isInstanceOf(ValidationException.class);
    }
}
