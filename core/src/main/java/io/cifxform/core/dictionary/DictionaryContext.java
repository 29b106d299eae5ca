package io.cifxform.core.dictionary;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the dictionary-backed services for one dictionary source: the parser, the extension overlay
 * on top of it and the deprecation index built from it, created in that order.
 *
 * <p>{@link #initialize()} runs the one-time parse; after it returns, every query on the three
 * services is a read of immutable state and may be made from any number of threads. Calling
 * queries without initializing first is also safe: the first one parses, under the same guard.
 */
public final class DictionaryContext {

    private static final Logger LOG = LoggerFactory.getLogger(DictionaryContext.class);

    private final DictionaryParser parser;
    private final ExtensionOverlay overlay;
    private final DeprecationIndex deprecations;

    public DictionaryContext(DictionarySource source, ExtensionMappings extensions) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(extensions, "extensions must not be null");
        this.parser = new DictionaryParser(source);
        this.overlay = new ExtensionOverlay(parser, extensions);
        this.deprecations = new DeprecationIndex(parser);
    }

    /** A context over {@code source} with the bundled extension table. */
    public static DictionaryContext of(DictionarySource source) {
        return new DictionaryContext(source, ExtensionMappings.bundled());
    }

    /**
     * Parses the dictionary and builds the deprecation index if not done yet.
     *
     * @return this context
     * @throws io.cifxform.core.error.DictionaryNotFoundException if the source cannot be read
     */
    public DictionaryContext initialize() {
        long start = System.nanoTime();
        parser.parse();
        deprecations.getAllDeprecatedFields();
        LOG.debug("Dictionary context for {} ready in {} ms", parser.source().name(), (System.nanoTime() - start) / 1_000_000);
        return this;
    }

    /** Discards all cached state; the next query re-reads the source. */
    public void invalidate() {
        deprecations.invalidate();
        parser.invalidate();
    }

    public DictionaryParser parser() {
        return parser;
    }

    public ExtensionOverlay overlay() {
        return overlay;
    }

    public DeprecationIndex deprecations() {
        return deprecations;
    }
}
