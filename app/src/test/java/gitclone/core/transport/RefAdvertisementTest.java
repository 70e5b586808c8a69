package gitclone.core.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import gitclone.core.refs.Ref;
import gitclone.exceptions.ProtocolException;
import gitclone.testing.SmartHttpFixture;

public class RefAdvertisementTest {

    private static final String SHA_A = "1111111111111111111111111111111111111111";
    private static final String SHA_B = "2222222222222222222222222222222222222222";

    @Test
    void testParsesSmartHttpAdvertisement() throws Exception {
        byte[] body = SmartHttpFixture.advertisement("multi_ack symref=HEAD:refs/heads/main agent=git/2.43.0",
                SHA_A + " HEAD",
                SHA_A + " refs/heads/main",
                SHA_B + " refs/heads/dev");

        RefAdvertisement adv = RefAdvertisement.parse(body);

        assertEquals(List.of(
                new AdvertisedRef("HEAD", SHA_A),
                new AdvertisedRef("refs/heads/main", SHA_A),
                new AdvertisedRef("refs/heads/dev", SHA_B)), adv.getRefs());
        assertTrue(adv.getCapabilities().contains("multi_ack"));
        assertTrue(adv.getCapabilities().contains("agent=git/2.43.0"));
        assertEquals(Optional.of("refs/heads/main"), adv.getHeadTarget());
    }

    @Test
    void testWithoutServiceBanner() throws Exception {
        byte[] body = new PktLine.Writer()
                .line(SHA_A + " refs/heads/main\0side-band-64k\n")
                .flush()
                .toByteArray();

        RefAdvertisement adv = RefAdvertisement.parse(body);

        assertEquals(1, adv.getRefs().size());
        assertEquals(Optional.empty(), adv.getHeadTarget());
    }

    @Test
    void testEmptyRepositoryPlaceholder() throws Exception {
        byte[] body = SmartHttpFixture.advertisement("agent=git/2.43.0",
                "0000000000000000000000000000000000000000 capabilities^{}");

        RefAdvertisement adv = RefAdvertisement.parse(body);

        assertTrue(adv.isEmpty());
        assertTrue(adv.getCapabilities().contains("agent=git/2.43.0"));
    }

    @Test
    void testPeeledTagLinesIgnored() throws Exception {
        byte[] body = SmartHttpFixture.advertisement("",
                SHA_A + " refs/heads/main",
                SHA_B + " refs/tags/v1",
                SHA_A + " refs/tags/v1^{}");

        RefAdvertisement adv = RefAdvertisement.parse(body);

        assertEquals(2, adv.getRefs().size());
        assertFalse(adv.findRef("refs/tags/v1^{}").isPresent());
        assertEquals(SHA_B, adv.findRef("refs/tags/v1").get().getSha());
    }

    @Test
    void testMalformedRefLine() {
        byte[] body = SmartHttpFixture.advertisement("", "abc refs/heads/main");

        assertThrows(ProtocolException.class, () -> RefAdvertisement.parse(body));
    }

    @Test
    void testRemoteError() {
        byte[] body = new PktLine.Writer().line("ERR access denied\n").toByteArray();

        ProtocolException e = assertThrows(ProtocolException.class, () -> RefAdvertisement.parse(body));
        assertTrue(e.getMessage().contains("access denied"));
    }

    @Test
    void testLocalRefsMakeHeadSymbolic() throws Exception {
        RefAdvertisement adv = RefAdvertisement.parse(SmartHttpFixture.advertisement("symref=HEAD:refs/heads/main",
                SHA_A + " HEAD",
                SHA_A + " refs/heads/main"));

        List<Ref> refs = adv.toLocalRefs();

        assertEquals(Ref.symbolic("HEAD", "refs/heads/main"), refs.get(0));
        assertEquals(Ref.direct("refs/heads/main", SHA_A), refs.get(1));
    }

    @Test
    void testLocalHeadStaysDetachedWithoutSymref() throws Exception {
        RefAdvertisement adv = RefAdvertisement.parse(SmartHttpFixture.advertisement("",
                SHA_A + " HEAD"));

        assertEquals(List.of(Ref.direct("HEAD", SHA_A)), adv.toLocalRefs());
    }

    @Test
    void testNamesOutsideRefsNotPersisted() throws Exception {
        RefAdvertisement adv = RefAdvertisement.parse(SmartHttpFixture.advertisement("",
                SHA_A + " refs/heads/main",
                SHA_B + " config",
                SHA_B + " objects/ce/013625030ba8dba906f756967f9e9ca394464a",
                SHA_B + " refs/../config"));

        assertEquals(4, adv.getRefs().size());
        assertEquals(List.of(Ref.direct("refs/heads/main", SHA_A)), adv.toLocalRefs());
    }

    @Test
    void testUnusableSymrefTargetRejected() throws Exception {
        RefAdvertisement adv = RefAdvertisement.parse(SmartHttpFixture.advertisement("symref=HEAD:config",
                SHA_A + " HEAD"));

        assertThrows(ProtocolException.class, adv::toLocalRefs);
    }
}
