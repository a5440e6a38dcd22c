package io.b2mash.b2b.artifactvault.exception;

import java.io.IOException;

/** An I/O failure in the underlying filesystem. */
public class StorageException extends VaultException {

  public StorageException(String detail, IOException cause) {
    super("Storage failure", detail, cause);
  }
}
