package io.statusmvp.tokenbalances.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.statusmvp.tokenbalances.model.SupportedChain;
import io.statusmvp.tokenbalances.testsupport.StubExchange;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

class TrustWalletAssetsClientTest {
  private static final String BASE_URL = "https://raw.githubusercontent.com/trustwallet/assets/master";

  @Test
  void checksumsAddressesPerEip55() {
    assertEquals(
        "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed",
        TrustWalletAssetsClient.checksumAddress("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed"));
    assertEquals(
        "0xfB6916095ca1df60bB79Ce92cE3Ea74c37c5d359",
        TrustWalletAssetsClient.checksumAddress("0xFB6916095CA1DF60BB79CE92CE3EA74C37C5D359"));
    assertNull(TrustWalletAssetsClient.checksumAddress("0x1234"));
  }

  @Test
  void probesChecksummedPathWithSingleByteRange() {
    StubExchange exchange = new StubExchange(req -> StubExchange.status(HttpStatus.PARTIAL_CONTENT));
    TrustWalletAssetsClient client = new TrustWalletAssetsClient(exchange.webClient(), BASE_URL, 2000);

    Optional<String> logo =
        client.find(LogoLookup.of("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed", SupportedChain.BSC));

    String expected =
        BASE_URL + "/blockchains/smartchain/assets/0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed/logo.png";
    assertEquals(Optional.of(expected), logo);
    var request = exchange.requests().get(0);
    assertEquals(HttpMethod.GET, request.method());
    assertEquals("bytes=0-0", request.headers().getFirst(HttpHeaders.RANGE));
    assertEquals(expected, request.url().toString());
  }

  @Test
  void missingAssetIsNotAnError() {
    StubExchange exchange = new StubExchange(req -> StubExchange.status(HttpStatus.NOT_FOUND));
    TrustWalletAssetsClient client = new TrustWalletAssetsClient(exchange.webClient(), BASE_URL, 2000);

    assertEquals(
        Optional.empty(),
        client.find(LogoLookup.of("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed", SupportedChain.BASE)));
  }

  @Test
  void serverErrorIsAnUpstreamFailure() {
    StubExchange exchange = new StubExchange(req -> StubExchange.status(HttpStatus.INTERNAL_SERVER_ERROR));
    TrustWalletAssetsClient client = new TrustWalletAssetsClient(exchange.webClient(), BASE_URL, 2000);

    assertThrows(
        UpstreamException.class,
        () -> client.find(LogoLookup.of("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed", SupportedChain.BASE)));
  }

  @Test
  void invalidAddressSkipsTheProbe() {
    StubExchange exchange = new StubExchange(req -> StubExchange.status(HttpStatus.OK));
    TrustWalletAssetsClient client = new TrustWalletAssetsClient(exchange.webClient(), BASE_URL, 2000);

    assertEquals(Optional.empty(), client.find(LogoLookup.of("not-an-address", SupportedChain.BASE)));
    assertTrue(exchange.requests().isEmpty());
  }
}
