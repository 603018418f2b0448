package com.cankv.net;

import com.cankv.command.Command;
import com.cankv.command.CommandInterpreter;
import com.cankv.config.AppProperties;
import com.cankv.constants.RespProtocol;
import com.cankv.core.KeyValueStore;
import com.cankv.error.RequestException;
import com.cankv.metric.Counter;
import com.cankv.metric.MetricsRegistry;
import com.cankv.resp.RespDecoder;
import com.cankv.resp.RespEncoder;
import com.cankv.resp.RespMessageReader;
import com.cankv.resp.Value;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetServer;
import io.vertx.core.net.NetServerOptions;
import io.vertx.core.net.NetSocket;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * RESP protokolünü konuşan TCP sunucusudur. Quarkus ayağa kalktığında
 * yapılandırılan adresi dinler ve kabul edilen her bağlantı için bir
 * {@link ConnectionWorker} oluşturur. İşçi gelen baytlardan mesajları çözer,
 * {@link CommandInterpreter} ile komuta çevirir, {@link KeyValueStore}
 * üzerinde çalıştırır ve cevabı yazar.
 *
 * <p>Yorumlanamayan isteklere cevap verilmez: hata loglanır, istek atlanır ve
 * bağlantı bir sonraki isteği beklemeye devam eder.</p>
 */
@Startup
@Singleton
public class RespServer implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(RespServer.class);
    private static final Value PONG = Value.bulk(RespProtocol.PONG);
    private static final Value OK = Value.bulk(RespProtocol.OK);

    private final Vertx vertx;
    private final KeyValueStore store;
    private final CommandInterpreter interpreter;
    private final MetricsRegistry metrics;
    private final AppProperties.Network networkConfig;
    private final AppProperties.Protocol protocolConfig;

    private final Counter currConnections;
    private final Counter totalConnections;
    private final Counter rejected;

    private volatile boolean running;
    private NetServer netServer;

    @Inject
    public RespServer(Vertx vertx,
                      KeyValueStore store,
                      CommandInterpreter interpreter,
                      MetricsRegistry metrics,
                      AppProperties properties)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.store = Objects.requireNonNull(store, "store");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.networkConfig = Objects.requireNonNull(properties.network(), "networkConfig");
        this.protocolConfig = Objects.requireNonNull(properties.protocol(), "protocolConfig");
        this.currConnections = metrics.counter("connections_current");
        this.totalConnections = metrics.counter("connections_total");
        this.rejected = metrics.counter("commands_rejected");
    }

    @PostConstruct
    void start()
    {
        NetServerOptions options = new NetServerOptions()
                .setHost(networkConfig.host())
                .setPort(networkConfig.port())
                .setTcpNoDelay(true)
                .setReuseAddress(true)
                .setAcceptBacklog(Math.max(1, networkConfig.backlog()));

        netServer = vertx.createNetServer(options);
        netServer.connectHandler(this::onClientConnected);
        try {
            netServer.listen().toCompletionStage().toCompletableFuture().join();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to bind " + RespProtocol.PROTOCOL + " port " + networkConfig.port(), e);
        }

        running = true;
        LOG.infof("%s server listening on %s:%d", RespProtocol.PROTOCOL, networkConfig.host(), netServer.actualPort());
    }

    private void onClientConnected(NetSocket socket)
    {
        if (!running) {
            socket.close();
            return;
        }
        currConnections.inc();
        totalConnections.inc();

        ConnectionWorker worker = new ConnectionWorker(socket, new RespMessageReader(
                new RespDecoder(protocolConfig.maxBulkBytes(), protocolConfig.maxLineBytes())));
        socket.closeHandler(v -> {
            worker.onClosed();
            currConnections.dec();
        });
        socket.exceptionHandler(e -> {
            if (LOG.isDebugEnabled()) {
                LOG.debugf(e, "Client %s disconnected with error", socket.remoteAddress());
            }
            worker.close();
        });
        socket.handler(worker::handleData);
    }

    /**
     * Komutu depoya karşı çalıştırır ve gönderilecek cevabı üretir.
     */
    Value execute(Command command)
    {
        metrics.counter("commands_" + command.name()).inc();
        if (command instanceof Command.Ping) {
            return PONG;
        }
        if (command instanceof Command.Echo echo) {
            return echo.message();
        }
        if (command instanceof Command.Get get) {
            return store.get(get.key()).orElse(Value.NIL);
        }
        if (command instanceof Command.Set set) {
            store.set(set.key(), set.value(), set.expireAtMillis());
            return OK;
        }
        throw new IllegalStateException("Unhandled command " + command);
    }

    public int port()
    {
        return netServer != null ? netServer.actualPort() : networkConfig.port();
    }

    @PreDestroy
    @Override
    public void close()
    {
        running = false;
        if (netServer != null) {
            try {
                netServer.close().toCompletionStage().toCompletableFuture().join();
            } catch (RuntimeException e) {
                LOG.debug("Failed to close net server", e);
            }
        }
    }

    /**
     * Tek bir bağlantının istek döngüsüdür. Boşta iken tampondaki bir sonraki
     * tam mesajı arar; bir mesaj çalışırken ve cevabı yazılırken yeni istek
     * okunmaz.
     */
    private final class ConnectionWorker
    {
        private final NetSocket socket;
        private final RespMessageReader reader;
        private boolean closed;
        private boolean executing;

        private ConnectionWorker(NetSocket socket, RespMessageReader reader)
        {
            this.socket = socket;
            this.reader = reader;
        }

        private void handleData(Buffer data)
        {
            if (closed) return;
            reader.feed(data);
            processBuffer();
        }

        private void onClosed()
        {
            closed = true;
        }

        private void processBuffer()
        {
            while (!closed && !executing)
            {
                Value message;
                try {
                    message = reader.nextMessage();
                } catch (RequestException e) {
                    reject(e);
                    continue;
                }
                if (message == null) {
                    return;
                }
                executeMessage(message);
            }
        }

        private void executeMessage(Value message)
        {
            executing = true;
            vertx.executeBlocking(() -> handle(message), false).onComplete(ar -> {
                if (closed) {
                    executing = false;
                    return;
                }
                if (ar.failed()) {
                    if (LOG.isDebugEnabled()) {
                        LOG.debugf(ar.cause(), "Client %s disconnected with error", socket.remoteAddress());
                    }
                    executing = false;
                    close();
                    return;
                }
                Buffer reply = ar.result();
                if (reply == null) {
                    executing = false;
                    processBuffer();
                    return;
                }
                socket.write(reply).onComplete(written -> {
                    executing = false;
                    if (written.failed()) {
                        if (LOG.isDebugEnabled()) {
                            LOG.debugf(written.cause(), "Failed to write reply to %s", socket.remoteAddress());
                        }
                        close();
                        return;
                    }
                    processBuffer();
                });
            });
        }

        private Buffer handle(Value message)
        {
            Command command;
            try {
                command = interpreter.toCommand(message);
            } catch (RequestException e) {
                reject(e);
                return null;
            }
            return RespEncoder.encode(execute(command));
        }

        private void reject(RequestException e)
        {
            rejected.inc();
            LOG.warnf("Dropping request from %s: %s", socket.remoteAddress(), e.getMessage());
        }

        private void close()
        {
            if (!closed) {
                closed = true;
                socket.close();
            }
        }
    }
}
