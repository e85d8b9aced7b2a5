package io.statusmvp.tokenbalances.testsupport;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** WebClient backed by a canned responder; every request is recorded. */
public class StubExchange implements ExchangeFunction {
  private final Function<ClientRequest, ClientResponse> responder;
  private final List<ClientRequest> requests = new ArrayList<>();

  public StubExchange(Function<ClientRequest, ClientResponse> responder) {
    this.responder = responder;
  }

  public static ClientResponse json(HttpStatus status, String body) {
    return ClientResponse.create(status)
        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .body(body)
        .build();
  }

  public static ClientResponse bytes(HttpStatus status, String contentType, byte[] body) {
    ClientResponse.Builder b = ClientResponse.create(status);
    if (contentType != null) b.header(HttpHeaders.CONTENT_TYPE, contentType);
    return b.body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body))).build();
  }

  public static ClientResponse status(HttpStatus status) {
    return ClientResponse.create(status).build();
  }

  @Override
  public synchronized Mono<ClientResponse> exchange(ClientRequest request) {
    requests.add(request);
    return Mono.fromCallable(() -> responder.apply(request));
  }

  public WebClient webClient() {
    return WebClient.builder().exchangeFunction(this).build();
  }

  public synchronized List<ClientRequest> requests() {
    return List.copyOf(requests);
  }
}
