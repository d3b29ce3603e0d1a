/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.internal;

import ilp.sender.AuthFailureException;
import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPrivateKeySpec;
import java.util.Base64;

/**
 * Signs TCP authentication challenges with an EC P-256 private key, using SHA256withECDSA. The
 * signature is DER encoded, which is what the server verifies.
 */
public final class ChallengeSigner {
  static final String CURVE = "secp256r1";
  static final String ALGORITHM = "SHA256withECDSA";

  /**
   * Creates a signer from the private scalar {@code d} of a JSON Web Key, base64url encoded.
   *
   * @throws IllegalArgumentException if the value isn't a valid P-256 private key
   */
  public static ChallengeSigner create(String d) {
    if (d == null) throw new NullPointerException("d == null");
    byte[] scalar;
    try {
      scalar = Base64.getUrlDecoder().decode(d.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("private key is not base64url encoded: " + e.getMessage());
    }
    try {
      AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
      parameters.init(new ECGenParameterSpec(CURVE));
      ECParameterSpec spec = parameters.getParameterSpec(ECParameterSpec.class);
      BigInteger s = new BigInteger(1, scalar);
      if (s.signum() == 0 || s.compareTo(spec.getOrder()) >= 0) {
        throw new IllegalArgumentException("private key is out of range for curve " + CURVE);
      }
      PrivateKey key = KeyFactory.getInstance("EC").generatePrivate(new ECPrivateKeySpec(s, spec));
      return new ChallengeSigner(key);
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("invalid private key: " + e.getMessage(), e);
    }
  }

  final PrivateKey privateKey;

  ChallengeSigner(PrivateKey privateKey) {
    this.privateKey = privateKey;
  }

  /** Returns the base64 (not url-safe) encoded signature of the challenge. */
  public String sign(byte[] challenge) {
    try {
      Signature signature = Signature.getInstance(ALGORITHM);
      signature.initSign(privateKey);
      signature.update(challenge);
      return Base64.getEncoder().encodeToString(signature.sign());
    } catch (GeneralSecurityException e) {
      throw new AuthFailureException("Could not sign the authentication challenge", e);
    }
  }

  @Override public String toString() {
    return "ChallengeSigner{" + CURVE + "}";
  }
}
