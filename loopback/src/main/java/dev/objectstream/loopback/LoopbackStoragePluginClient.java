/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package dev.objectstream.loopback;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayOutputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import dev.objectstream.common.Flags;
import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.common.stream.StreamErrorException;
import dev.objectstream.common.stream.UnexpectedEndOfStreamException;
import dev.objectstream.common.util.Exceptions;
import dev.objectstream.storage.GetObjectClientStream;
import dev.objectstream.storage.GetObjectRequest;
import dev.objectstream.storage.GetObjectResponse;
import dev.objectstream.storage.GetObjectStream;
import dev.objectstream.storage.PutObjectClientStream;
import dev.objectstream.storage.PutObjectRequest;
import dev.objectstream.storage.PutObjectResponse;
import dev.objectstream.storage.PutObjectStream;
import dev.objectstream.storage.StoragePluginService;

/**
 * Calls a {@link StoragePluginService} through in-memory object streams, as a host calls a plugin. Every
 * call connects a new stream and runs the plugin handler on a worker thread.
 *
 * <p>Once a handler returns, this client closes whatever the handler left open, so that the host observes
 * the end of the stream instead of waiting forever. An exception thrown by a handler is sent to the host
 * as an error if the stream is still open.
 */
public final class LoopbackStoragePluginClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LoopbackStoragePluginClient.class);

    /**
     * Returns a new {@link LoopbackStoragePluginClient} which calls the specified
     * {@link StoragePluginService} using its own worker threads. The number of the worker threads is
     * limited by {@link Flags#numLoopbackWorkers()}. The worker threads are stopped on {@link #close()}.
     */
    public static LoopbackStoragePluginClient of(StoragePluginService plugin) {
        final int numWorkers = Flags.numLoopbackWorkers();
        final ThreadPoolExecutor executor = new ThreadPoolExecutor(
                numWorkers, numWorkers, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("loopback-storage-plugin-%d")
                                          .setDaemon(true)
                                          .build());
        executor.allowCoreThreadTimeOut(true);
        return new LoopbackStoragePluginClient(plugin, executor, true);
    }

    /**
     * Returns a new {@link LoopbackStoragePluginClient} which runs the handlers of the specified
     * {@link StoragePluginService} using the specified {@link ExecutorService}. The {@link ExecutorService}
     * is not shut down on {@link #close()}.
     */
    public static LoopbackStoragePluginClient of(StoragePluginService plugin, ExecutorService executor) {
        return new LoopbackStoragePluginClient(plugin, executor, false);
    }

    private final StoragePluginService plugin;
    private final ExecutorService executor;
    private final boolean shutdownOnClose;

    private LoopbackStoragePluginClient(StoragePluginService plugin, ExecutorService executor,
                                        boolean shutdownOnClose) {
        this.plugin = requireNonNull(plugin, "plugin");
        this.executor = requireNonNull(executor, "executor");
        this.shutdownOnClose = shutdownOnClose;
    }

    /**
     * Starts a {@code GetObject} call and returns the stream which receives the object.
     */
    public GetObjectClientStream getObject(GetObjectRequest request) {
        return startGetObject(request).client();
    }

    /**
     * Starts a {@code PutObject} call and returns the stream which sends the object.
     */
    public PutObjectClientStream putObject() {
        return startPutObject().client();
    }

    /**
     * Downloads the whole content of the specified object.
     *
     * @throws StreamErrorException if the plugin failed to send the object
     * @throws InterruptedException if the current thread is interrupted while downloading.
     *                              The call is closed.
     */
    public byte[] download(String bucketName, String key) throws InterruptedException {
        final GetObjectStream stream = startGetObject(GetObjectRequest.of(bucketName, key));
        final ByteArrayOutputStream content = new ByteArrayOutputStream();
        try {
            for (;;) {
                final GetObjectResponse response = stream.client().receive();
                if (response == null) {
                    break;
                }
                final byte[] chunk = response.fileChunk();
                content.write(chunk, 0, chunk.length);
            }
        } catch (InterruptedException e) {
            stream.close();
            throw e;
        }
        return content.toByteArray();
    }

    /**
     * Uploads the specified content as an object, split into chunks of {@link Flags#defaultChunkSize()}
     * bytes. An empty content is sent as a single empty chunk.
     *
     * @return the {@link PutObjectResponse} sent by the plugin
     * @throws StreamErrorException if the plugin failed to store the object
     * @throws UnexpectedEndOfStreamException if the plugin ended the call without a response
     * @throws InterruptedException if the current thread is interrupted while uploading.
     *                              The call is closed.
     */
    public PutObjectResponse upload(String bucketName, String key, byte[] data) throws InterruptedException {
        requireNonNull(bucketName, "bucketName");
        requireNonNull(key, "key");
        requireNonNull(data, "data");
        checkArgument(!bucketName.isEmpty(), "bucketName is empty.");
        checkArgument(!key.isEmpty(), "key is empty.");

        final PutObjectStream stream = startPutObject();
        final PutObjectClientStream client = stream.client();
        final int chunkSize = Flags.defaultChunkSize();
        try {
            try {
                int offset = 0;
                do {
                    final int length = Math.min(chunkSize, data.length - offset);
                    client.send(PutObjectRequest.of(bucketName, key, data, offset, length));
                    offset += length;
                } while (offset < data.length);
            } catch (ClosedStreamException e) {
                logger.debug("The plugin stopped receiving {}/{}; waiting for its response.", bucketName, key);
            }

            final PutObjectResponse response = client.closeAndReceive();
            if (response == null) {
                throw new UnexpectedEndOfStreamException(
                        "PutObject ended without a response: " + bucketName + '/' + key);
            }
            return response;
        } catch (InterruptedException e) {
            stream.closeRequest();
            stream.closeResponse();
            throw e;
        }
    }

    private GetObjectStream startGetObject(GetObjectRequest request) {
        requireNonNull(request, "request");
        checkState(!executor.isShutdown(), "client closed already");

        final GetObjectStream stream = new GetObjectStream();
        executor.execute(() -> {
            try {
                plugin.getObject(request, stream.server());
                logger.debug("GetObject handler returned: {}", request);
            } catch (Throwable cause) {
                handleFailure("GetObject", cause, stream.isClosed(), () -> stream.server().sendError(cause));
            } finally {
                stream.close();
            }
        });
        return stream;
    }

    private PutObjectStream startPutObject() {
        checkState(!executor.isShutdown(), "client closed already");

        final PutObjectStream stream = new PutObjectStream();
        executor.execute(() -> {
            try {
                plugin.putObject(stream.server());
                logger.debug("PutObject handler returned");
            } catch (Throwable cause) {
                // Stop the host from sending first, so that it starts waiting for the error.
                stream.closeRequest();
                handleFailure("PutObject", cause, stream.isResponseClosed(),
                              () -> stream.server().sendError(cause));
            } finally {
                stream.closeRequest();
                stream.closeResponse();
            }
        });
        return stream;
    }

    private static void handleFailure(String method, Throwable cause, boolean closed, ErrorSender sender) {
        if (Exceptions.isStreamCancellation(cause)) {
            logger.debug("{} handler stopped after the host closed the stream:", method, cause);
            return;
        }
        logger.warn("{} handler failed:", method, cause);
        if (closed) {
            return;
        }
        try {
            sender.sendError();
        } catch (ClosedStreamException e) {
            logger.debug("The host closed the stream before receiving the {} failure.", method);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        if (shutdownOnClose) {
            executor.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("plugin", plugin)
                          .add("executor", executor)
                          .toString();
    }

    @FunctionalInterface
    private interface ErrorSender {
        void sendError() throws InterruptedException;
    }
}
