package com.minidisc.core.tailscale;

import com.minidisc.common.exception.AddressSourceException;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.TailnetStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TailscaleAddressSourceTest {

    private static final String STATUS_JSON = "{"
        + "\"Self\":{\"HostName\":\"alpha\"},"
        + "\"TailscaleIPs\":[\"fd7a:115c:a1e0::1\",\"100.64.0.1\"],"
        + "\"Peer\":{"
        + "\"nodekey:b\":{\"HostName\":\"beta\",\"Online\":true,\"TailscaleIPs\":[\"100.64.0.2\",\"fd7a:115c:a1e0::2\"]},"
        + "\"nodekey:c\":{\"HostName\":\"gamma\",\"Online\":false,\"TailscaleIPs\":[\"100.64.0.3\"]},"
        + "\"nodekey:d\":{\"HostName\":\"delta\",\"Online\":true,\"TailscaleIPs\":[\"100.64.0.4\"]}"
        + "}}";

    @TempDir
    Path tempDir;

    @Test
    void testParseStatusKeepsOnlinePeers() {
        TailnetStatus status = TailscaleAddressSource.parseStatus(STATUS_JSON.getBytes(StandardCharsets.UTF_8));

        assertEquals(AddrPort.parseAddress("100.64.0.1"), status.getLocalAddress());
        assertEquals(List.of(AddrPort.parseAddress("100.64.0.2"), AddrPort.parseAddress("100.64.0.4")),
            status.getPeerAddresses());
    }

    @Test
    void testParseStatusWithoutPeers() {
        TailnetStatus status = TailscaleAddressSource.parseStatus(
            "{\"TailscaleIPs\":[\"100.64.0.1\"]}".getBytes(StandardCharsets.UTF_8));

        assertTrue(status.getPeerAddresses().isEmpty());
    }

    @Test
    void testParseStatusWithoutLocalIpv4() {
        assertThrows(AddressSourceException.class, () -> TailscaleAddressSource.parseStatus(
            "{\"TailscaleIPs\":[\"fd7a:115c:a1e0::1\"]}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(AddressSourceException.class, () -> TailscaleAddressSource.parseStatus(
            "not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void testStatusOverUnixSocket() throws Exception {
        Path socketPath = tempDir.resolve("tailscaled.sock");
        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
             TailscaleAddressSource source = new TailscaleAddressSource(socketPath)) {
            server.bind(UnixDomainSocketAddress.of(socketPath));
            CompletableFuture<String> request = CompletableFuture.supplyAsync(() -> serveOnce(server,
                "HTTP/1.1 200 OK\r\nContent-Type: application/json\r\n"
                    + "Content-Length: " + STATUS_JSON.getBytes(StandardCharsets.UTF_8).length + "\r\n\r\n"
                    + STATUS_JSON));

            TailnetStatus status = source.status();

            assertEquals(AddrPort.parseAddress("100.64.0.1"), status.getLocalAddress());
            assertEquals(2, status.getPeerAddresses().size());
            String head = request.get(5, TimeUnit.SECONDS);
            assertTrue(head.startsWith("GET /localapi/v0/status HTTP/1.1\r\n"));
            assertTrue(head.toLowerCase().contains("host: local-tailscaled.sock\r\n"));
        }
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void testChunkedStatusResponse() throws Exception {
        Path socketPath = tempDir.resolve("chunked.sock");
        byte[] json = STATUS_JSON.getBytes(StandardCharsets.UTF_8);
        int half = json.length / 2;
        String chunked = "HTTP/1.1 200 OK\r\nContent-Type: application/json\r\nTransfer-Encoding: chunked\r\n\r\n"
            + Integer.toHexString(half) + "\r\n" + STATUS_JSON.substring(0, half) + "\r\n"
            + Integer.toHexString(json.length - half) + "\r\n" + STATUS_JSON.substring(half) + "\r\n"
            + "0\r\n\r\n";
        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
             TailscaleAddressSource source = new TailscaleAddressSource(socketPath)) {
            server.bind(UnixDomainSocketAddress.of(socketPath));
            CompletableFuture.supplyAsync(() -> serveOnce(server, chunked));

            TailnetStatus status = source.status();

            assertEquals(AddrPort.parseAddress("100.64.0.1"), status.getLocalAddress());
            assertEquals(List.of(AddrPort.parseAddress("100.64.0.2"), AddrPort.parseAddress("100.64.0.4")),
                status.getPeerAddresses());
        }
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void testNonOkStatusIsRejected() throws Exception {
        Path socketPath = tempDir.resolve("forbidden.sock");
        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
             TailscaleAddressSource source = new TailscaleAddressSource(socketPath)) {
            server.bind(UnixDomainSocketAddress.of(socketPath));
            CompletableFuture.supplyAsync(() -> serveOnce(server,
                "HTTP/1.1 403 Forbidden\r\nContent-Length: 0\r\n\r\n"));

            AddressSourceException e = assertThrows(AddressSourceException.class, source::status);
            assertTrue(e.getMessage().contains("403"));
        }
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void testMissingSocket() {
        try (TailscaleAddressSource source = new TailscaleAddressSource(tempDir.resolve("missing.sock"))) {
            assertThrows(AddressSourceException.class, source::status);
        }
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void testSilentDaemonTimesOut() throws Exception {
        Path socketPath = tempDir.resolve("silent.sock");
        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
             TailscaleAddressSource source = new TailscaleAddressSource(socketPath, Duration.ofMillis(200))) {
            server.bind(UnixDomainSocketAddress.of(socketPath));

            // 连接被接受但从不响应
            long start = System.nanoTime();
            assertThrows(AddressSourceException.class, source::status);
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 5000);
        }
    }

    private static String serveOnce(ServerSocketChannel server, String response) {
        try (SocketChannel client = server.accept()) {
            ByteBuffer buffer = ByteBuffer.allocate(4096);
            StringBuilder head = new StringBuilder();
            while (!head.toString().contains("\r\n\r\n") && client.read(buffer) >= 0) {
                buffer.flip();
                head.append(StandardCharsets.US_ASCII.decode(buffer));
                buffer.clear();
            }
            client.write(ByteBuffer.wrap(response.getBytes(StandardCharsets.UTF_8)));
            return head.toString();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
