package io.statusmvp.tokenbalances.error;

public class MissingCredentialException extends ApiException {
  public MissingCredentialException(String credential) {
    super(credential + " required", 503);
  }
}
