package com.ibstrader.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ibstrader.config.ExchangeConfig;
import com.ibstrader.exception.ConfigurationException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.crypto.StructuredDataEncoder;
import org.web3j.utils.Numeric;

/**
 * Signs exchange actions with the configured API secret.
 *
 * <p>An action is hashed as {@code keccak256(msgpack(action) || nonce (8 bytes, big endian)
 * || vault flag [|| vault address])}. That hash becomes the {@code connectionId} of an
 * EIP-712 {@code Agent} struct which is signed with secp256k1 under the fixed
 * {@code Exchange} domain (chain id 1337, zero verifying contract).
 */
@Component
public class HyperliquidSigner {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    private static final int AGENT_CHAIN_ID = 1337;

    private final ExchangeConfig exchangeConfig;
    private final ObjectMapper objectMapper;
    private volatile Credentials credentials;

    public HyperliquidSigner(ExchangeConfig exchangeConfig, ObjectMapper objectMapper) {
        this.exchangeConfig = exchangeConfig;
        this.objectMapper = objectMapper;
    }

    /**
     * Produces the {@code {r, s, v}} signature object for an action.
     *
     * @param vaultAddress sub-account the action is for, or null for the account itself
     */
    public Map<String, Object> signAction(Map<String, Object> action, long nonce, String vaultAddress) {
        byte[] connectionId = actionHash(action, nonce, vaultAddress);
        String source = exchangeConfig.isMainnet() ? "a" : "b";
        byte[] digest = agentDigest(source, connectionId);

        Sign.SignatureData signature = Sign.signMessage(digest, credentials().getEcKeyPair(), false);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("r", Numeric.toHexString(signature.getR()));
        result.put("s", Numeric.toHexString(signature.getS()));
        result.put("v", Numeric.toBigInt(signature.getV()).intValue());
        return result;
    }

    /** Address of the signing key (the API wallet, which may differ from the account address). */
    public String signerAddress() {
        return credentials().getAddress();
    }

    /** keccak256 over the msgpack action, the nonce and the vault marker. */
    public byte[] actionHash(Map<String, Object> action, long nonce, String vaultAddress) {
        byte[] packed = HyperliquidWire.pack(action);
        byte[] vault = vaultAddress == null ? new byte[0] : Numeric.hexStringToByteArray(vaultAddress);
        ByteBuffer buffer = ByteBuffer.allocate(packed.length + Long.BYTES + 1 + vault.length);
        buffer.put(packed);
        buffer.putLong(nonce);
        buffer.put((byte) (vaultAddress == null ? 0 : 1));
        buffer.put(vault);
        return Hash.sha3(buffer.array());
    }

    /** EIP-712 digest of the {@code Agent} struct that is actually signed. */
    public byte[] agentDigest(String source, byte[] connectionId) {
        String typedData = agentTypedData(source, connectionId);
        try {
            return new StructuredDataEncoder(typedData).hashStructuredData();
        } catch (IOException e) {
            throw new IllegalStateException("EIP-712 encoding failed", e);
        }
    }

    private String agentTypedData(String source, byte[] connectionId) {
        Map<String, Object> domain = new LinkedHashMap<>();
        domain.put("name", "Exchange");
        domain.put("version", "1");
        domain.put("chainId", AGENT_CHAIN_ID);
        domain.put("verifyingContract", ZERO_ADDRESS);

        Map<String, Object> types = new LinkedHashMap<>();
        types.put(
                "EIP712Domain",
                List.of(
                        field("name", "string"),
                        field("version", "string"),
                        field("chainId", "uint256"),
                        field("verifyingContract", "address")));
        types.put("Agent", List.of(field("source", "string"), field("connectionId", "bytes32")));

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("source", source);
        message.put("connectionId", Numeric.toHexString(connectionId));

        Map<String, Object> typedData = new LinkedHashMap<>();
        typedData.put("types", types);
        typedData.put("primaryType", "Agent");
        typedData.put("domain", domain);
        typedData.put("message", message);
        try {
            return objectMapper.writeValueAsString(typedData);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Typed data serialization failed", e);
        }
    }

    private static Map<String, String> field(String name, String type) {
        Map<String, String> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("type", type);
        return field;
    }

    private Credentials credentials() {
        Credentials current = credentials;
        if (current == null) {
            String secret = exchangeConfig.getApiSecret();
            if (secret == null || secret.isBlank()) {
                throw new ConfigurationException("ibstrader.exchange.api-secret (HL_API_SECRET) is required in LIVE mode");
            }
            current = Credentials.create(secret);
            credentials = current;
        }
        return current;
    }
}
