package gitclone.core.transport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import gitclone.config.ClientConfig;
import gitclone.core.pack.PackEntryType;
import gitclone.exceptions.TransportException;
import gitclone.testing.PackBuilder;
import gitclone.testing.SmartHttpFixture;

public class SmartHttpTransportTest {

    private static final String SHA = "ce013625030ba8dba906f756967f9e9ca394464a";

    @Test
    void testDiscoverAndFetch() throws Exception {
        byte[] pack = new PackBuilder().object(PackEntryType.BLOB, "hello\n").build();
        ByteArrayOutputStream response = new ByteArrayOutputStream();
        response.writeBytes("0008NAK\n".getBytes(StandardCharsets.US_ASCII));
        response.writeBytes(pack);
        byte[] advertisement = SmartHttpFixture.advertisement("symref=HEAD:refs/heads/main",
                SHA + " HEAD", SHA + " refs/heads/main");

        try (SmartHttpFixture server = new SmartHttpFixture(advertisement, response.toByteArray())) {
            SmartHttpTransport transport = new SmartHttpTransport(server.url() + "/", ClientConfig.defaults());

            RefAdvertisement refs = transport.discoverRefs();
            assertEquals(2, refs.getRefs().size());
            assertEquals(Optional.of("refs/heads/main"), refs.getHeadTarget());

            byte[] fetched = transport.fetchPack(UploadPackRequest.forRefs(refs.getRefs()));
            assertArrayEquals(pack, fetched);
            assertEquals(1, server.getUploadRequests().size());
        }
    }

    @Test
    void testBaseUrlLosesTrailingSlashes() {
        SmartHttpTransport transport = new SmartHttpTransport("http://example.com/repo.git//", ClientConfig.defaults());

        assertEquals("http://example.com/repo.git", transport.getBaseUrl());
    }

    @Test
    void testNotFound() throws Exception {
        try (SmartHttpFixture server = new SmartHttpFixture(new byte[0], new byte[0])) {
            server.setRefsStatus(404);
            SmartHttpTransport transport = new SmartHttpTransport(server.url(), ClientConfig.defaults());

            assertThrows(TransportException.class, transport::discoverRefs);
        }
    }

    @Test
    void testConnectionRefused() throws Exception {
        String url;
        try (SmartHttpFixture server = new SmartHttpFixture(new byte[0], new byte[0])) {
            url = server.url();
        }
        SmartHttpTransport transport = new SmartHttpTransport(url, ClientConfig.defaults());

        assertThrows(TransportException.class, () -> transport.fetchPack(UploadPackRequest.forRefs(
                List.of(new AdvertisedRef("refs/heads/main", SHA)))));
    }
}
