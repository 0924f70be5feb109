package com.amqpclient.connection;

import com.amqpclient.address.ConnectionTarget;
import com.amqpclient.config.ConnectionOptions;
import com.amqpclient.error.TransportError;
import com.amqpclient.error.TransportErrorKind;
import com.amqpclient.reconnect.ReconnectOptions;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Reconnect Engine Tests")
class ReconnectEngineTest {

    private ConnectionHandler handler;
    private ManualContainer container;
    private FakeTransportFactory transports;

    @BeforeEach
    void setUp() {
        handler = mock(ConnectionHandler.class);
        newContainer(handler);
    }

    private void newContainer(ConnectionHandler containerHandler) {
        container = new ManualContainer(containerHandler);
        transports = new FakeTransportFactory(container);
        container.setTransports(transports);
    }

    private static ReconnectOptions fast() {
        return ReconnectOptions.builder().delay(Duration.ofMillis(1)).build();
    }

    private ReconnectEngine engine() {
        return container.engines().get(container.engines().size() - 1);
    }

    @Nested
    @DisplayName("Candidate cycling")
    class CandidateCycling {

        @Test
        @DisplayName("Should try original, then original again, then alternate with failover")
        void testFailoverSequence() {
            transports.failEverything();
            container.connect("hostA", ConnectionOptions.builder()
                .failoverUrls("hostB")
                .reconnect(fast())
                .build());

            container.runUntil(() -> transports.openCount() >= 6, 100);

            assertThat(transports.hosts().subList(0, 6))
                .containsExactly("hostA", "hostA", "hostB", "hostA", "hostB", "hostA");
        }

        @Test
        @DisplayName("Should cycle through every failover address in order")
        void testLongFailoverList() {
            transports.failEverything();
            container.connect("hostA", ConnectionOptions.builder()
                .failoverUrls("hostB", "hostC")
                .reconnect(fast())
                .build());

            container.runUntil(() -> transports.openCount() >= 8, 100);

            assertThat(transports.hosts().subList(0, 8))
                .containsExactly("hostA", "hostA", "hostB", "hostC", "hostA", "hostB", "hostC", "hostA");
        }

        @Test
        @DisplayName("Should reconnect with default backoff when only failover is set")
        void testFailoverEnablesDefaultPolicy() {
            transports.failEverything();
            container.connect("hostA", ConnectionOptions.builder().failoverUrls("hostB").build());

            container.runUntil(() -> transports.openCount() >= 3, 20);

            assertThat(transports.hosts()).containsExactly("hostA", "hostA", "hostB");
            // 10ms before the first retry, 20ms before the second
            assertThat(container.nowMillis()).isEqualTo(30);
        }

        @Test
        @DisplayName("Should retarget the original address with an empty failover list")
        void testEmptyFailoverList() {
            transports.failEverything();
            container.connect("hostA", ConnectionOptions.builder()
                .failoverUrls(Collections.<String>emptyList())
                .reconnect(fast())
                .build());

            container.runUntil(() -> transports.openCount() >= 4, 50);

            assertThat(transports.hosts().subList(0, 4)).containsOnly("hostA");
        }

        @Test
        @DisplayName("Should keep the cycle position across unrelated option updates")
        void testUnrelatedUpdatesKeepCursor() {
            newContainer(new ConnectionHandler() {
                private int errors;

                @Override
                public void onTransportError(Connection connection, TransportError error) {
                    connection.updateOptions(ConnectionOptions.builder().user("user" + (++errors)).build());
                }
            });
            transports.failEverything();
            container.connect("hostA", ConnectionOptions.builder()
                .failoverUrls("hostB", "hostC")
                .reconnect(fast())
                .build());

            container.runUntil(() -> transports.openCount() >= 6, 100);

            assertThat(transports.hosts().subList(0, 6))
                .containsExactly("hostA", "hostA", "hostB", "hostC", "hostA", "hostB");
            assertThat(engine().getConnection().user()).startsWith("user");
        }
    }

    @Nested
    @DisplayName("Sticky override")
    class StickyOverride {

        @Test
        @DisplayName("Should use connect address first and reconnect URL afterwards")
        void testReconnectUrlAtConnect() {
            List<String> errorHosts = new ArrayList<>();
            newContainer(new ConnectionHandler() {
                @Override
                public void onTransportError(Connection connection, TransportError error) {
                    errorHosts.add(error.getTarget().getHost());
                    switch (errorHosts.size()) {
                        case 2:
                            assertThat(connection.user()).isEqualTo("user0");
                            break;
                        case 3:
                            connection.updateOptions(ConnectionOptions.builder().reconnectUrl("nosuchhost1").build());
                            assertThat(connection.user()).isEqualTo("user0");
                            break;
                        case 5:
                            connection.container().stop();
                            break;
                        default:
                            break;
                    }
                }
            });
            transports.failEverything();
            container.connect("nosuchhost0", ConnectionOptions.builder()
                .reconnect(fast())
                .virtualHost("vhost0")
                .user("user0")
                .reconnectUrl("hahaha1")
                .build());

            container.runUntil(container::isStopped, 50);

            assertThat(errorHosts).containsExactly("nosuchhost0", "hahaha1", "hahaha1", "nosuchhost1", "nosuchhost1");
            assertThat(engine().getState()).isEqualTo(EngineState.CLOSED);
        }

        @Test
        @DisplayName("Should follow reconnect URL updates made in the error callback")
        void testUpdateSimple() {
            List<String> errorHosts = new ArrayList<>();
            newContainer(new ConnectionHandler() {
                @Override
                public void onTransportError(Connection connection, TransportError error) {
                    errorHosts.add(error.getTarget().getHost());
                    switch (errorHosts.size()) {
                        case 2:
                            connection.updateOptions(ConnectionOptions.builder().reconnectUrl("nosuchhost1").build());
                            assertThat(connection.user()).isEqualTo("user0");
                            break;
                        case 3:
                            connection.updateOptions(ConnectionOptions.builder().reconnectUrl("notsuchahostatall").build());
                            break;
                        case 5:
                            connection.updateOptions(ConnectionOptions.builder().user("user1").build());
                            break;
                        case 6:
                            assertThat(connection.user()).isEqualTo("user1");
                            connection.updateOptions(ConnectionOptions.builder().reconnectUrl("nosuchhost1").build());
                            break;
                        case 8:
                            connection.container().stop();
                            break;
                        default:
                            break;
                    }
                }
            });
            transports.failEverything();
            container.connect("nosuchhost0", ConnectionOptions.builder()
                .reconnect(fast())
                .virtualHost("vhost0")
                .user("user0")
                .build());

            container.runUntil(container::isStopped, 50);

            assertThat(errorHosts).containsExactly(
                "nosuchhost0", "nosuchhost0", "nosuchhost1", "notsuchahostatall",
                "notsuchahostatall", "notsuchahostatall", "nosuchhost1", "nosuchhost1");
            assertThat(engine().getConnection().virtualHost()).isEqualTo("vhost0");
        }

        @Test
        @DisplayName("Should pick up a failover list added in the error callback")
        void testUpdateFailover() {
            List<String> errorHosts = new ArrayList<>();
            newContainer(new ConnectionHandler() {
                @Override
                public void onTransportError(Connection connection, TransportError error) {
                    errorHosts.add(error.getTarget().getHost());
                    switch (errorHosts.size()) {
                        case 2:
                            connection.updateOptions(ConnectionOptions.builder().failoverUrls("nosuchhost1").build());
                            assertThat(connection.user()).isEqualTo("user0");
                            break;
                        case 3:
                            connection.updateOptions(ConnectionOptions.builder().user("user1").build());
                            break;
                        case 4:
                            assertThat(connection.user()).isEqualTo("user1");
                            break;
                        case 6:
                            connection.container().stop();
                            break;
                        default:
                            break;
                    }
                }
            });
            transports.failEverything();
            container.connect("nosuchhost0", ConnectionOptions.builder()
                .reconnect(fast())
                .virtualHost("vhost0")
                .user("user0")
                .build());

            container.runUntil(container::isStopped, 50);

            assertThat(errorHosts).containsExactly(
                "nosuchhost0", "nosuchhost0", "nosuchhost1", "nosuchhost0", "nosuchhost1", "nosuchhost0");
        }

        @Test
        @DisplayName("Should resume the failover cycle where it stopped once the override is cleared")
        void testClearOverrideResumesCycle() {
            transports.failEverything();
            Connection connection = container.connect("hostA", ConnectionOptions.builder()
                .failoverUrls("hostB")
                .reconnect(fast())
                .build());
            container.runUntil(() -> transports.openCount() >= 2, 20);

            connection.updateOptions(ConnectionOptions.builder().reconnectUrl("hostX").build());
            container.runUntil(() -> transports.openCount() >= 4, 20);

            connection.updateOptions(ConnectionOptions.builder().reconnectUrl("").build());
            container.runUntil(() -> transports.openCount() >= 6, 20);

            assertThat(transports.hosts().subList(0, 6))
                .containsExactly("hostA", "hostA", "hostX", "hostX", "hostB", "hostA");
        }
    }

    @Nested
    @DisplayName("Policy")
    class Policy {

        @Test
        @DisplayName("Should close after one failure without a reconnect policy")
        void testNoPolicy() {
            transports.failEverything();
            Connection connection = container.connect("hostA");

            container.runUntil(connection::isClosed, 10);

            assertThat(transports.openCount()).isEqualTo(1);
            assertThat(container.pendingTasks()).isZero();
            assertThat(connection.lastError().getKind()).isEqualTo(TransportErrorKind.ADDRESS_UNREACHABLE);
            verify(handler, times(1)).onTransportError(eq(connection), any(TransportError.class));
            verify(handler, times(1)).onTransportClose(connection);
            verify(handler, never()).onConnectionClose(any());
        }

        @Test
        @DisplayName("Should give up when max attempts are used up")
        void testPolicyExhausted() {
            transports.failEverything();
            Connection connection = container.connect("hostA", ConnectionOptions.builder()
                .reconnect(ReconnectOptions.builder().delay(Duration.ofMillis(1)).maxAttempts(2).build())
                .build());

            container.runUntil(connection::isClosed, 20);

            assertThat(transports.openCount()).isEqualTo(3);
            assertThat(connection.lastError().getKind()).isEqualTo(TransportErrorKind.POLICY_EXHAUSTED);
            assertThat(connection.lastError().getTarget().getHost()).isEqualTo("hostA");
            verify(handler, times(3)).onTransportError(eq(connection), any(TransportError.class));
            verify(handler, times(1)).onTransportClose(connection);
        }

        @Test
        @DisplayName("Should back off exponentially up to the max delay")
        void testBackoffTiming() {
            transports.failEverything();
            container.connect("hostA", ConnectionOptions.builder()
                .reconnect(ReconnectOptions.builder()
                    .delay(Duration.ofMillis(100))
                    .delayMultiplier(2.0)
                    .maxDelay(Duration.ofMillis(300))
                    .build())
                .build());

            List<Long> openTimes = new ArrayList<>();
            for (int opens = 1; opens <= 5; opens++) {
                final int expected = opens;
                container.runUntil(() -> transports.openCount() >= expected, 10);
                openTimes.add(container.nowMillis());
            }

            assertThat(openTimes).containsExactly(0L, 100L, 300L, 600L, 900L);
        }

        @Test
        @DisplayName("Should reset the attempt count once a connection opens")
        void testAttemptCountResetsOnOpen() {
            Connection connection = container.connect("hostA", ConnectionOptions.builder()
                .reconnect(ReconnectOptions.builder().delay(Duration.ofMillis(1)).maxAttempts(1).build())
                .build());

            transports.last().fail(TransportErrorKind.ADDRESS_UNREACHABLE);
            container.runNext();
            transports.last().establish();
            assertThat(connection.isOpen()).isTrue();

            transports.last().listener.onClosed(false);
            assertThat(connection.getState()).isEqualTo(EngineState.RETRY_WAIT);
            container.runNext();
            assertThat(transports.openCount()).isEqualTo(3);

            transports.last().fail(TransportErrorKind.ADDRESS_UNREACHABLE);
            assertThat(connection.isClosed()).isTrue();
            assertThat(connection.lastError().getKind()).isEqualTo(TransportErrorKind.POLICY_EXHAUSTED);
        }

        @Test
        @DisplayName("Should retry authentication failures like any other failure")
        void testAuthFailureRetried() {
            transports.script(target -> FakeTransportFactory.Outcome.AUTH_FAILURE);
            Connection connection = container.connect("hostA", ConnectionOptions.builder()
                .reconnect(fast())
                .saslAllowedMechs("PLAIN")
                .build());

            container.runUntil(() -> transports.openCount() >= 3, 20);

            assertThat(connection.lastError().getKind()).isEqualTo(TransportErrorKind.AUTHENTICATION_FAILED);
            assertThat(connection.isClosed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Close and stop")
    class CloseAndStop {

        @Test
        @DisplayName("Should stop reconnecting when closed inside the transport error callback")
        void testCloseInErrorCallback() {
            doAnswer(invocation -> {
                Connection c = invocation.getArgument(0);
                c.close();
                return null;
            }).when(handler).onTransportError(any(), any());
            transports.failEverything();
            Connection connection = container.connect("hostA", ConnectionOptions.builder()
                .failoverUrls("hostB")
                .reconnect(fast())
                .build());

            container.runUntil(connection::isClosed, 10);

            assertThat(transports.openCount()).isEqualTo(1);
            assertThat(container.pendingTasks()).isZero();
            verify(handler, times(1)).onTransportError(eq(connection), any(TransportError.class));
            verify(handler, times(1)).onTransportClose(connection);
            verify(handler, never()).onConnectionClose(any());
        }

        @Test
        @DisplayName("Should ignore a retry timer that fires after close")
        void testCloseDuringRetryWait() {
            Connection connection = container.connect("hostA", ConnectionOptions.builder()
                .reconnect(ReconnectOptions.builder().delay(Duration.ofMillis(100)).build())
                .build());
            transports.last().fail(TransportErrorKind.ADDRESS_UNREACHABLE);
            assertThat(connection.getState()).isEqualTo(EngineState.RETRY_WAIT);

            connection.close();
            container.advance(Duration.ofSeconds(1));

            assertThat(connection.isClosed()).isTrue();
            assertThat(transports.openCount()).isEqualTo(1);
            assertThat(connection.lastError().getKind()).isEqualTo(TransportErrorKind.LOCAL_ABORT);
            verify(handler, times(1)).onTransportClose(connection);
        }

        @Test
        @DisplayName("Should abort the attempt in flight when closed while connecting")
        void testCloseWhileConnecting() {
            Connection connection = container.connect("hostA", ConnectionOptions.builder().reconnect(fast()).build());
            FakeTransportFactory.FakeTransport transport = transports.last();

            connection.close();

            assertThat(transport.aborted).isTrue();
            assertThat(connection.isClosed()).isTrue();
            verify(handler, never()).onConnectionClose(any());
        }

        @Test
        @DisplayName("Should report a clean close after the peer answers")
        void testCleanClose() {
            Connection connection = container.connect("hostA", ConnectionOptions.builder().reconnect(fast()).build());
            FakeTransportFactory.FakeTransport transport = transports.last();
            transport.establish();
            ErrorCondition condition = new ErrorCondition(Symbol.valueOf("amqp:connection:forced"), "done");

            connection.close(condition);
            assertThat(transport.closeRequested).isTrue();
            assertThat(transport.closeCondition).isSameAs(condition);
            assertThat(connection.isOpen()).isTrue();

            transport.completeClose();

            assertThat(connection.isClosed()).isTrue();
            verify(handler).onConnectionOpen(connection);
            verify(handler).onConnectionClose(connection);
            verify(handler).onTransportClose(connection);
            verify(handler, never()).onTransportError(any(), any());
        }

        @Test
        @DisplayName("Should close every connection when the container stops")
        void testContainerStop() {
            transports.failEverything();
            Connection first = container.connect("hostA", ConnectionOptions.builder().reconnect(fast()).build());
            Connection second = container.connect("hostB", ConnectionOptions.builder().reconnect(fast()).build());
            container.runUntil(() -> transports.openCount() >= 4, 20);

            container.stop();

            assertThat(first.isClosed()).isTrue();
            assertThat(second.isClosed()).isTrue();
            assertThat(first.lastError().getKind()).isEqualTo(TransportErrorKind.LOCAL_ABORT);
            assertThat(container.pendingTasks()).isZero();
            verify(handler).onTransportClose(first);
            verify(handler).onTransportClose(second);
        }

        @Test
        @DisplayName("Should treat a second close as a no-op")
        void testCloseTwice() {
            Connection connection = container.connect("hostA");
            connection.close();
            connection.close();

            verify(handler, times(1)).onTransportClose(connection);
        }
    }

    @Nested
    @DisplayName("Peer events")
    class PeerEvents {

        @Test
        @DisplayName("Should mark the connection reconnected after a retry cycle")
        void testReconnectedFlag() {
            Connection connection = container.connect("hostA", ConnectionOptions.builder().reconnect(fast()).build());
            transports.last().establish();
            assertThat(connection.reconnected()).isFalse();

            transports.last().listener.onClosed(false);
            container.runNext();
            transports.last().establish();

            assertThat(connection.reconnected()).isTrue();
            assertThat(engine().getOpenCount()).isEqualTo(2);
            verify(handler, times(2)).onConnectionOpen(connection);
        }

        @Test
        @DisplayName("Should reconnect when the peer closes with an error")
        void testPeerCloseWithReconnect() {
            Connection connection = container.connect("hostA", ConnectionOptions.builder().reconnect(fast()).build());
            transports.last().establish();

            transports.last().remoteClose(new ErrorCondition(Symbol.valueOf("amqp:connection:forced"), "failover"));

            assertThat(connection.getState()).isEqualTo(EngineState.RETRY_WAIT);
            assertThat(connection.lastError().getKind()).isEqualTo(TransportErrorKind.PEER_REFUSED);
            assertThat(connection.lastError().getMessage()).contains("hostA").contains("failover");
        }

        @Test
        @DisplayName("Should report a connection error when the peer closes without reconnect")
        void testPeerCloseWithoutReconnect() {
            Connection connection = container.connect("hostA");
            transports.last().establish();
            ErrorCondition condition = new ErrorCondition(Symbol.valueOf("amqp:unauthorized-access"), "go away");

            transports.last().remoteClose(condition);

            assertThat(connection.isClosed()).isTrue();
            assertThat(connection.lastError().getKind()).isEqualTo(TransportErrorKind.AUTHENTICATION_FAILED);
            verify(handler).onConnectionError(connection, condition);
            verify(handler).onTransportClose(connection);
            verify(handler, never()).onConnectionClose(any());
        }

        @Test
        @DisplayName("Should drop events from an attempt that is no longer current")
        void testStaleTransportEvents() {
            Connection connection = container.connect("hostA", ConnectionOptions.builder().reconnect(fast()).build());
            FakeTransportFactory.FakeTransport first = transports.last();
            first.fail(TransportErrorKind.ADDRESS_UNREACHABLE);
            container.runNext();

            first.listener.onEstablished();

            assertThat(connection.getState()).isEqualTo(EngineState.CONNECTING);
            assertThat(first.aborted).isTrue();
        }
    }

    @Nested
    @DisplayName("Handlers")
    class Handlers {

        @Test
        @DisplayName("Should keep reconnecting when a handler throws")
        void testThrowingHandler() {
            doThrow(new IllegalStateException("boom")).when(handler).onTransportError(any(), any());
            transports.failEverything();
            Connection connection = container.connect("hostA", ConnectionOptions.builder().reconnect(fast()).build());

            container.runUntil(() -> transports.openCount() >= 3, 20);

            assertThat(connection.isClosed()).isFalse();
        }

        @Test
        @DisplayName("Should prefer the handler set in connection options")
        void testPerConnectionHandler() {
            ConnectionHandler own = mock(ConnectionHandler.class);
            Connection connection = container.connect("hostA", ConnectionOptions.builder().handler(own).build());

            transports.last().establish();

            verify(own).onConnectionOpen(connection);
            verify(handler, never()).onConnectionOpen(any());
        }

        @Test
        @DisplayName("Should treat an exception from the transport factory as a failed attempt")
        void testFactoryThrows() {
            transports.throwOnOpen(new IllegalStateException("no event loop"));
            Connection connection = container.connect("hostA");

            assertThat(connection.isClosed()).isTrue();
            assertThat(connection.lastError().getDescription()).isEqualTo("no event loop");
            verify(handler).onTransportError(eq(connection), any(TransportError.class));
        }

        @Test
        @DisplayName("Should expose the current attempt address")
        void testCurrentUrl() {
            Connection connection = container.connect("amqps://hostA", ConnectionOptions.builder().user("alice").build());

            assertThat(connection.url().getHost()).isEqualTo("hostA");
            assertThat(connection.url().getPort()).isEqualTo(5671);
            assertThat(connection.user()).isEqualTo("alice");
            assertThat(connection.virtualHost()).isEmpty();
            assertThat(transports.last().options.user().get()).isEqualTo("alice");
        }

        @Test
        @DisplayName("Should refuse url() before any target is selected")
        void testUrlBeforeStart() {
            ReconnectEngine unstarted = new ReconnectEngine("unstarted", ConnectionTarget.parse("hostA"),
                ConnectionOptions.empty(), container, transports, handler, null);

            assertThatThrownBy(() -> unstarted.getConnection().url())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unstarted");
            assertThat(transports.openCount()).isZero();
        }
    }
}
