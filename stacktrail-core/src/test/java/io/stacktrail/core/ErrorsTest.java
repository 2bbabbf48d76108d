/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ErrorsTest {

    private static final EOFException EOF = new EOFException("EOF");

    @Nested
    @DisplayName("messages")
    class Messages {

        @Test
        void newErrorKeepsMessage() {
            assertThat(Errors.newError("EOF").getMessage()).isEqualTo("EOF");
        }

        @Test
        void errorfFormatsMessage() {
            assertThat(Errors.errorf("failed to execute query: %s, %s", "SELECT * FROM err WHERE id=?", "test")
                            .getMessage())
                    .isEqualTo("failed to execute query: SELECT * FROM err WHERE id=?, test");
            assertThat(Errors.errorf("EOF: %d", 42).getMessage()).isEqualTo("EOF: 42");
        }

        @Test
        void wrapPrefixesMessage() {
            assertThat(Errors.wrap(EOF, "failed to execute query").getMessage())
                    .isEqualTo("failed to execute query: EOF");
            assertThat(Errors.wrapf(EOF, "failed to execute query: %s", "test").getMessage())
                    .isEqualTo("failed to execute query: test: EOF");
        }

        @Test
        void withMessageAliasesWrap() {
            assertThat(Errors.withMessage(EOF, "reading").getMessage()).isEqualTo("reading: EOF");
            assertThat(Errors.withMessagef(EOF, "reading %s", "config").getMessage())
                    .isEqualTo("reading config: EOF");
        }

        @Test
        void wrapWithCauseJoinsMessages() {
            Throwable err = Errors.wrap(EOF, "failed to execute query");
            Throwable cause = Errors.errorf("cause");

            assertThat(Errors.wrapWithCause(err, cause).getMessage()).isEqualTo("failed to execute query: EOF: cause");
        }

        @Test
        void withStackKeepsMessage() {
            assertThat(Errors.withStack(EOF).getMessage()).isEqualTo("EOF");
        }

        @Test
        void messagelessErrorsFallBackToToString() {
            IOException bare = new IOException();

            assertThat(Errors.wrap(bare, "reading").getMessage()).isEqualTo("reading: java.io.IOException");
            assertThat(Errors.withStack(bare).getMessage()).isEqualTo("java.io.IOException");
        }
    }

    @Nested
    @DisplayName("null errors")
    class NullErrors {

        @Test
        void everyWrappingOperationReturnsNull() {
            assertThat(Errors.withStack(null)).isNull();
            assertThat(Errors.wrap(null, "failed")).isNull();
            assertThat(Errors.wrapf(null, "failed: %s", "test")).isNull();
            assertThat(Errors.withMessage(null, "failed")).isNull();
            assertThat(Errors.withMessagef(null, "failed: %s", "test")).isNull();
            assertThat(Errors.wrapWithCause(null, Errors.newError("cause"))).isNull();
            assertThat(Errors.wrapWithCause(null, null)).isNull();
        }

        @Test
        void chainHelpersTolerateNull() {
            assertThat(Errors.unwrap(null)).isNull();
            assertThat(Errors.rootCause(null)).isNull();
            assertThat(Errors.as(null, IOException.class)).isEmpty();
            assertThat(Errors.is(null, null)).isTrue();
            assertThat(Errors.is(null, EOF)).isFalse();
            assertThat(Errors.is(EOF, null)).isFalse();
            assertThat(Errors.messageOf(null)).isNull();
        }

        @Test
        void nullCauseAnnotatesErrorAlone() {
            IllegalStateException plain = new IllegalStateException("plain");

            Throwable got = Errors.wrapWithCause(plain, null);

            assertThat(got).isInstanceOf(AnnotatedException.class);
            assertThat(got.getMessage()).isEqualTo("plain");
            assertThat(Errors.is(got, plain)).isTrue();
            assertThat(((HasCallStack) got).callStack().size()).isEqualTo(1);
        }

        @Test
        void nullCauseMergesIntoExistingStack() {
            AnnotatedException err = Errors.newError("e");

            Throwable got = Errors.wrapWithCause(err, null);

            assertThat(got).isSameAs(err);
            assertThat(err.callStack().size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("chain membership")
    class ChainMembership {

        @Test
        void withStackKeepsOriginal() {
            assertThat(Errors.is(Errors.withStack(EOF), EOF)).isTrue();
        }

        @Test
        void wrapKeepsOriginal() {
            AnnotatedException wrapped = Errors.wrap(EOF, "m");

            assertThat(Errors.is(wrapped, EOF)).isTrue();
            assertThat(Errors.as(wrapped, EOFException.class)).containsSame(EOF);
            assertThat(Errors.rootCause(wrapped)).isSameAs(EOF);
        }

        @Test
        void wrapWithCauseKeepsBothBranches() {
            Throwable err = Errors.wrap(EOF, "failed to execute query");
            UncheckedIOException cause = new UncheckedIOException(new IOException("disk"));

            Throwable got = Errors.wrapWithCause(err, cause);

            assertThat(Errors.is(got, err)).isTrue();
            assertThat(Errors.is(got, EOF)).isTrue();
            assertThat(Errors.is(got, cause)).isTrue();
            assertThat(Errors.is(got, cause.getCause())).isTrue();
            assertThat(Errors.as(got, UncheckedIOException.class)).containsSame(cause);
            assertThat(Errors.as(got, JoinedException.class)).isPresent();
        }

        @Test
        void unrelatedErrorIsNotInChain() {
            assertThat(Errors.is(Errors.wrap(EOF, "m"), new EOFException("EOF"))).isFalse();
        }

        @Test
        void unwrapGoesOneLevelDown() {
            AnnotatedException wrapped = Errors.wrap(EOF, "m");

            Throwable message = Errors.unwrap(wrapped);

            assertThat(message).isInstanceOf(MessageException.class).hasMessage("m: EOF");
            assertThat(Errors.unwrap(message)).isSameAs(EOF);
            assertThat(Errors.unwrap(EOF)).isNull();
        }

        @Test
        void unwrapOfJoinedErrorIsItsFirstBranch() {
            AnnotatedException err = Errors.newError("err");
            AnnotatedException cause = Errors.newError("cause");

            Throwable joined = Errors.unwrap(Errors.wrapWithCause(err, cause));

            assertThat(joined).isInstanceOf(JoinedException.class);
            assertThat(Errors.unwrap(joined)).isSameAs(err);
            assertThat(((MultiCause) joined).causes()).containsExactly(err, cause);
        }

        @Test
        void asFindsFirstStackBearingNode() {
            AnnotatedException inner = Errors.newError("inner");
            RuntimeException outer = new RuntimeException("outer", inner);

            assertThat(Errors.as(outer, HasCallStack.class)).containsSame(inner);
        }

        @Test
        void cyclicChainsTerminate() {
            CyclicException a = new CyclicException("a");
            CyclicException b = new CyclicException("b");
            a.next = b;
            b.next = a;

            assertThat(Errors.is(a, EOF)).isFalse();
            assertThat(Errors.rootCause(a)).isIn(a, b);
        }
    }

    @Nested
    @DisplayName("construct-or-merge")
    class ConstructOrMerge {

        @Test
        void withStackOnPlainErrorAllocatesWrapper() {
            Throwable got = Errors.withStack(EOF);

            assertThat(got).isInstanceOf(AnnotatedException.class);
            assertThat(Errors.unwrap(got)).isSameAs(EOF);
            assertThat(stackBearingNodes(got)).isEqualTo(1);
        }

        @Test
        void repeatedWithStackKeepsSingleNode() {
            AnnotatedException err = Errors.newError("e");
            Throwable current = err;
            for (int i = 0; i < 5; i++) {
                current = Errors.withStack(current);
            }

            assertThat(current).isSameAs(err);
            assertThat(stackBearingNodes(current)).isEqualTo(1);
            assertThat(err.callStack().size()).isEqualTo(6);
        }

        @Test
        void withStackMergesIntoNodeFoundDeeperInChain() {
            AnnotatedException inner = Errors.newError("inner");
            RuntimeException outer = new RuntimeException("outer", inner);

            Throwable got = Errors.withStack(outer);

            assertThat(got).isSameAs(inner);
            assertThat(inner.callStack().size()).isEqualTo(2);
            assertThat(Errors.is(got, outer)).isFalse();
        }

        @Test
        void wrapAlwaysAllocatesAndCarriesEarlierFrames() {
            AnnotatedException e1 = Errors.newError("e");

            AnnotatedException e2 = Errors.wrap(e1, "w");

            assertThat(e2).isNotSameAs(e1);
            assertThat(e2.callStack().size()).isEqualTo(2);
            assertThat(e2.callStack().frames().get(1)).isSameAs(e1.callStack().frames().get(0));
            assertThat(e1.callStack().size()).isEqualTo(1);
        }

        @Test
        void wrapWithCauseAppendsErrThenCauseFrames() {
            AnnotatedException cause = Errors.newError("cause");
            AnnotatedException err = Errors.wrap(Errors.newError("err"), "ctx");

            AnnotatedException got = (AnnotatedException) Errors.wrapWithCause(err, cause);

            assertThat(got.callStack().size()).isEqualTo(1 + 2 + 1);
            assertThat(got.callStack().frames().subList(1, 3))
                    .containsExactlyElementsOf(err.callStack().frames());
            assertThat(got.callStack().frames().get(3)).isSameAs(cause.callStack().frames().get(0));
        }
    }

    private static int stackBearingNodes(Throwable err) {
        int count = 0;
        for (Throwable t = err; t != null; t = t.getCause()) {
            if (t instanceof HasCallStack) count++;
        }
        return count;
    }

    private static final class CyclicException extends RuntimeException {
        Throwable next;

        CyclicException(String message) {
            super(message);
        }

        @Override
        public synchronized Throwable getCause() {
            return next;
        }
    }
}
