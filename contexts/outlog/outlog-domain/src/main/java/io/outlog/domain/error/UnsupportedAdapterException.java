package io.outlog.domain.error;

import java.io.Serial;
import java.util.Collection;

/** Raised synchronously when an unknown adapter name is passed to a configuration call. */
public final class UnsupportedAdapterException extends OutlogException {

  @Serial private static final long serialVersionUID = 1L;

  private final String adapterName;

  public UnsupportedAdapterException(String adapterName, Collection<String> supported) {
    super(
        OutlogErrorCode.UNSUPPORTED_ADAPTER,
        "Unsupported adapter '" + adapterName + "'; supported: " + supported);
    this.adapterName = adapterName;
  }

  public String adapterName() {
    return adapterName;
  }
}
