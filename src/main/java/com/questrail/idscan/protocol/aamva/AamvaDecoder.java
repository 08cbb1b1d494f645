package com.questrail.idscan.protocol.aamva;

import com.questrail.idscan.api.IdentityDocumentDecoder;
import com.questrail.idscan.protocol.aamva.codec.AamvaBody;
import com.questrail.idscan.protocol.aamva.codec.AamvaHeaderValidator;
import com.questrail.idscan.protocol.aamva.codec.impl.DefaultAamvaHeaderValidator;
import com.questrail.idscan.protocol.aamva.config.AamvaDecoderConfig;
import com.questrail.idscan.protocol.aamva.internal.decode.AamvaDecodeException;
import com.questrail.idscan.protocol.aamva.internal.decode.AamvaFieldExtractor;
import com.questrail.idscan.protocol.aamva.internal.record.AamvaRecordTokenizer;
import com.questrail.idscan.protocol.aamva.model.AamvaDecodeResult;
import com.questrail.idscan.protocol.aamva.model.ParsedIdentity;
import com.questrail.idscan.protocol.aamva.observability.AamvaDecodeFailureEvent;
import com.questrail.idscan.protocol.aamva.observability.AamvaDecodeObserver;
import com.questrail.idscan.protocol.aamva.observability.Slf4jAamvaDecodeObserver;

import java.util.Objects;

/**
 * AamvaDecoder
 * -----------------------------------------------------------------------------
 * Entry point for decoding AAMVA DL/ID barcode payloads.
 *
 * <pre>
 *   String payload
 *        → AamvaHeaderValidator    (empty / missing header → failure)
 *        → AamvaRecordTokenizer    (unrecognized records skipped)
 *        → AamvaFieldExtractor     (normalizers applied, optional fields degrade)
 *        → ParsedIdentity
 * </pre>
 *
 * <p>Instances are immutable and hold no per-call state, so one decoder can
 * serve any number of threads. Each call runs in time linear in the payload
 * length and performs no I/O apart from observer callbacks.</p>
 */
public final class AamvaDecoder implements IdentityDocumentDecoder<ParsedIdentity>
{
    private final AamvaHeaderValidator headerValidator;
    private final AamvaRecordTokenizer tokenizer;
    private final AamvaFieldExtractor extractor;
    private final AamvaDecodeObserver observer;

    /**
     * Creates a decoder with default configuration that logs through SLF4J.
     */
    public AamvaDecoder() {
        this(AamvaDecoderConfig.defaults());
    }

    public AamvaDecoder(AamvaDecoderConfig config) {
        this(config, new Slf4jAamvaDecodeObserver());
    }

    public AamvaDecoder(AamvaDecoderConfig config, AamvaDecodeObserver observer) {
        Objects.requireNonNull(config, "config");
        this.observer = Objects.requireNonNull(observer, "observer");
        this.headerValidator = new DefaultAamvaHeaderValidator(config.headerSearchWindow());
        this.tokenizer = new AamvaRecordTokenizer(observer);
        this.extractor = new AamvaFieldExtractor(config.dateOfBirthPolicy(), observer);
    }

    /**
     * Decodes one payload.
     *
     * @param payload raw string decoded from the PDF-417 symbol
     * @return the decoded identity
     * @throws AamvaDecodeException if the payload is empty, carries no AAMVA
     *         header, yields no name, or has an unresolvable date of birth under
     *         the strict policy
     */
    @Override
    public ParsedIdentity parse(String payload) {
        try {
            final AamvaBody body = headerValidator.validate(payload);
            return extractor.extract(body.header(), tokenizer.tokenize(body.records()));
        }
        catch (AamvaDecodeException e) {
            observer.onDecodeFailure(new AamvaDecodeFailureEvent(e.error(), e.getMessage()));
            throw e;
        }
    }

    /**
     * Decodes one payload, returning failures as a value.
     *
     * @param payload raw string decoded from the PDF-417 symbol
     * @return {@link AamvaDecodeResult.Success} or {@link AamvaDecodeResult.Failure}
     */
    public AamvaDecodeResult decode(String payload) {
        try {
            return new AamvaDecodeResult.Success(parse(payload));
        }
        catch (AamvaDecodeException e) {
            return new AamvaDecodeResult.Failure(e.error(), e.field().orElse(null), e.getMessage());
        }
    }
}
