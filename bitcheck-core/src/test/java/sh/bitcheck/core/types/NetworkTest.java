// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class NetworkTest {

    @Test
    void resolvesPrefixesIgnoringCase() {
        assertEquals(Optional.of(Network.MAINNET), Network.fromHrp("BC"));
        assertEquals(Optional.of(Network.TESTNET), Network.fromHrp("tb"));
        assertEquals(Optional.of(Network.REGTEST), Network.fromHrp("bcrt"));
        assertEquals(Optional.empty(), Network.fromHrp("ltc"));
        assertEquals(Optional.empty(), Network.fromHrp(null));
    }

    @Test
    void resolvesIds() {
        assertEquals(Optional.of(Network.TESTNET), Network.fromId(" Testnet "));
        assertEquals(Optional.empty(), Network.fromId("signet"));
        assertEquals("regtest", Network.REGTEST.id());
    }

    @Test
    void testnetAndRegtestShareVersionBytes() {
        assertEquals(Network.TESTNET.p2pkhVersion(), Network.REGTEST.p2pkhVersion());
        assertEquals(Network.TESTNET.p2shVersion(), Network.REGTEST.p2shVersion());
        assertNotEquals(Network.TESTNET.hrp(), Network.REGTEST.hrp());
    }

    @Test
    void addressTypeLabels() {
        assertEquals("p2pkh", AddressType.P2PKH.label());
        assertTrue(AddressType.TAPROOT.isSegwit());
        assertTrue(AddressType.SEGWIT_V0.isSegwit());
        assertFalse(AddressType.P2SH.isSegwit());
        assertFalse(AddressType.INVALID.isSegwit());
    }
}
