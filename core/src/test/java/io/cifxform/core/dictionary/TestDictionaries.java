package io.cifxform.core.dictionary;

import java.util.concurrent.atomic.AtomicInteger;

/** Shared fixtures for the dictionary tests. */
final class TestDictionaries {

    static final String RESOURCE = "test-dictionary.dic";

    private TestDictionaries() {}

    static DictionarySource testDictionary() {
        return DictionarySource.fromClasspath(RESOURCE, TestDictionaries.class.getClassLoader());
    }

    /** Wraps the test dictionary and counts reads. */
    static final class CountingSource extends DictionarySource {

        private final DictionarySource delegate = testDictionary();
        private final AtomicInteger reads = new AtomicInteger();

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public String read() {
            reads.incrementAndGet();
            return delegate.read();
        }

        int reads() {
            return reads.get();
        }
    }
}
