package com.ammann.conversion.converter;

import com.ammann.conversion.enumeration.Format;
import com.ammann.conversion.model.FormatPair;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Immutable map from direct format pairs to the converter performing them.
 * <p>
 * The registry only executes single hops; multi-hop paths are planned by the format graph
 * and executed by the engine.
 */
public final class ConverterRegistry {

    private static final Logger LOG = Logger.getLogger(ConverterRegistry.class);

    private final Map<FormatPair, DocumentConverter> converters;

    private ConverterRegistry(Map<FormatPair, DocumentConverter> converters) {
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(converters));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry with every leaf converter shipped with the service.
     */
    public static ConverterRegistry defaults() {
        return builder()
                .register(Format.TEXT, Format.HTML, new TextToHtmlConverter())
                .register(Format.MARKDOWN, Format.HTML, new MarkdownToHtmlConverter())
                .register(Format.HTML, Format.TEXT, new HtmlToTextConverter())
                .register(Format.HTML, Format.MARKDOWN, new HtmlToMarkdownConverter())
                .register(Format.HTML, Format.PDF, new HtmlToPdfConverter())
                .register(Format.HTML, Format.DOCX, new HtmlToDocxConverter())
                .register(Format.PDF, Format.TEXT, new PdfToTextConverter())
                .register(Format.DOCX, Format.TEXT, new DocxToTextConverter())
                .build();
    }

    public boolean supports(FormatPair pair) {
        return converters.containsKey(pair);
    }

    /** Registered pairs in registration order. */
    public Set<FormatPair> pairs() {
        return converters.keySet();
    }

    /**
     * Performs one direct conversion.
     *
     * @throws ConversionException with the converter's failure kind, or INTERNAL_ERROR when
     *     the pair is not registered or the converter throws an unchecked exception
     */
    public byte[] convert(FormatPair pair, byte[] payload) throws ConversionException {
        DocumentConverter converter = converters.get(pair);
        if (converter == null) {
            throw ConversionException.internal("No converter registered for " + pair, null);
        }
        try {
            byte[] output = converter.convert(payload);
            if (output == null) {
                throw ConversionException.internal("Converter for " + pair + " returned no output", null);
            }
            return output;
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Converter for %s failed unexpectedly", pair);
            throw ConversionException.internal(
                    "Converter for " + pair + " failed: " + e.getClass().getSimpleName(), e);
        }
    }

    public static final class Builder {

        private final Map<FormatPair, DocumentConverter> converters = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(Format source, Format target, DocumentConverter converter) {
            return register(FormatPair.of(source, target), converter);
        }

        public Builder register(FormatPair pair, DocumentConverter converter) {
            Objects.requireNonNull(converter, "converter");
            if (pair.isIdentity()) {
                throw new IllegalArgumentException("Identity conversions need no converter: " + pair);
            }
            converters.put(pair, converter);
            return this;
        }

        /** Removes a previously registered pair, if present. */
        public Builder exclude(FormatPair pair) {
            converters.remove(pair);
            return this;
        }

        /** Copies every registration of {@code registry} into this builder. */
        public Builder from(ConverterRegistry registry) {
            converters.putAll(registry.converters);
            return this;
        }

        public ConverterRegistry build() {
            return new ConverterRegistry(converters);
        }
    }
}
