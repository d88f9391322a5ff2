package com.ibstrader.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibstrader.config.ExchangeConfig;
import com.ibstrader.exception.ConfigurationException;
import com.ibstrader.exchange.HyperliquidSigner;
import com.ibstrader.exchange.HyperliquidWire;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

/**
 * Signing tests. The signature is checked by recovering the public key from the
 * digest, which is what the exchange does to authenticate an action.
 */
class HyperliquidSignerTest {

    private static final String PRIVATE_KEY = "0x0123456789012345678901234567890123456789012345678901234567890123";

    private ExchangeConfig exchangeConfig;
    private HyperliquidSigner signer;

    @BeforeEach
    void setUp() {
        exchangeConfig = new ExchangeConfig();
        exchangeConfig.setApiSecret(PRIVATE_KEY);
        signer = new HyperliquidSigner(exchangeConfig, new ObjectMapper());
    }

    private static Map<String, Object> leverageAction() {
        return HyperliquidWire.updateLeverageAction(0, true, 3);
    }

    @Test
    @DisplayName("Signature recovers to the signing key")
    void recoversSigner() throws Exception {
        Map<String, Object> action = leverageAction();
        long nonce = 1_700_000_000_000L;

        Map<String, Object> signature = signer.signAction(action, nonce, null);

        byte[] digest = signer.agentDigest("a", signer.actionHash(action, nonce, null));
        Sign.SignatureData data = new Sign.SignatureData(
                (byte) ((Integer) signature.get("v")).intValue(),
                Numeric.hexStringToByteArray((String) signature.get("r")),
                Numeric.hexStringToByteArray((String) signature.get("s")));
        BigInteger recovered = Sign.signedMessageHashToKey(digest, data);

        assertThat(recovered).isEqualTo(Credentials.create(PRIVATE_KEY).getEcKeyPair().getPublicKey());
        assertThat((Integer) signature.get("v")).isIn(27, 28);
        assertThat(signer.signerAddress()).isEqualTo(Credentials.create(PRIVATE_KEY).getAddress());
    }

    @Test
    @DisplayName("Action hash depends on nonce and vault")
    void hashInputs() {
        byte[] base = signer.actionHash(leverageAction(), 1L, null);

        assertThat(base).hasSize(32);
        assertThat(signer.actionHash(leverageAction(), 1L, null)).isEqualTo(base);
        assertThat(signer.actionHash(leverageAction(), 2L, null)).isNotEqualTo(base);
        assertThat(signer.actionHash(leverageAction(), 1L, "0x1111111111111111111111111111111111111111"))
                .isNotEqualTo(base);
    }

    @Test
    @DisplayName("Mainnet and testnet digests differ by source")
    void sourceByNetwork() {
        byte[] connectionId = signer.actionHash(leverageAction(), 1L, null);

        assertThat(signer.agentDigest("a", connectionId)).isNotEqualTo(signer.agentDigest("b", connectionId));
    }

    @Test
    @DisplayName("Missing secret is a configuration error")
    void missingSecret() {
        exchangeConfig.setApiSecret(null);
        HyperliquidSigner unconfigured = new HyperliquidSigner(exchangeConfig, new ObjectMapper());

        assertThatThrownBy(() -> unconfigured.signAction(leverageAction(), 1L, null))
                .isInstanceOf(ConfigurationException.class);
    }
}
