package com.hao.glock.integration.lock.redis;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 最小 RESP 服务端，仅应答 PING
 *
 * 用于在没有真实 Redis 的情况下验证建连与探活路径：
 * PING 返回 +PONG，其余命令（HELLO、CLIENT SETINFO 等握手命令）返回 unknown command，
 * Lettuce 会据此退回 RESP2 并忽略可选的握手命令。
 */
@Slf4j
final class RespStubServer implements AutoCloseable {

    private final ServerSocket serverSocket;
    private final ExecutorService executor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("resp-stub-%d").build());
    private final List<Socket> sockets = new CopyOnWriteArrayList<>();
    private final AtomicInteger accepted = new AtomicInteger();

    RespStubServer() throws IOException {
        serverSocket = new ServerSocket(0, 128, InetAddress.getLoopbackAddress());
        executor.submit(this::acceptLoop);
    }

    String getAddress() {
        return "127.0.0.1:" + serverSocket.getLocalPort();
    }

    int getAcceptedCount() {
        return accepted.get();
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                log.debug("RESP桩停止接收连接|Resp_stub_accept_stop,reason={}", e.getMessage());
                return;
            }
            accepted.incrementAndGet();
            sockets.add(socket);
            executor.submit(() -> serve(socket));
        }
    }

    private void serve(Socket socket) {
        try (Socket s = socket) {
            InputStream in = new BufferedInputStream(s.getInputStream());
            OutputStream out = s.getOutputStream();
            List<String> command;
            while ((command = readCommand(in)) != null) {
                String name = command.isEmpty() ? "" : command.get(0).toUpperCase(Locale.ROOT);
                String reply = "PING".equals(name)
                        ? "+PONG\r\n"
                        : "-ERR unknown command '" + name + "'\r\n";
                out.write(reply.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (IOException e) {
            log.debug("RESP桩连接断开|Resp_stub_connection_closed,reason={}", e.getMessage());
        }
    }

    private static List<String> readCommand(InputStream in) throws IOException {
        String header = readLine(in);
        if (header == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (!header.startsWith("*")) {
            // inline 命令
            for (String part : header.trim().split("\\s+")) {
                parts.add(part);
            }
            return parts;
        }
        int count = Integer.parseInt(header.substring(1));
        for (int i = 0; i < count; i++) {
            String lengthLine = readLine(in);
            if (lengthLine == null) {
                return null;
            }
            int length = Integer.parseInt(lengthLine.substring(1));
            byte[] payload = in.readNBytes(length + 2);
            if (payload.length < length + 2) {
                return null;
            }
            parts.add(new String(payload, 0, length, StandardCharsets.UTF_8));
        }
        return parts;
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                String line = buffer.toString(StandardCharsets.UTF_8);
                return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            }
            buffer.write(b);
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        for (Socket socket : sockets) {
            socket.close();
        }
        executor.shutdownNow();
    }
}
