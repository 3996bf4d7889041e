/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures.codec;

enum IdentityEncoder implements Encoder<String> {
  INSTANCE;

  @Override
  public String encode(final String item) {
    return item;
  }

  @Override
  public String decode(final String encoded) {
    return encoded;
  }

  @Override
  public String getName() {
    return "identity";
  }
}
