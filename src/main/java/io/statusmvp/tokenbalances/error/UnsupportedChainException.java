package io.statusmvp.tokenbalances.error;

public class UnsupportedChainException extends ApiException {
  public UnsupportedChainException(String chain) {
    super("Unsupported chain: " + chain, 400);
  }
}
