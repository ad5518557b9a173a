package com.codeheadsystems.tessera.server.manager;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;

/**
 * Keyed HMAC-SHA256 fingerprint of {@link DeviceMetadata}.
 * <p>
 * Keyed so that a stored fingerprint cannot be recomputed from guessed device details.
 * With no key configured, fingerprinting is disabled and {@link #fingerprint} returns null.
 */
public class DeviceFingerprinter {

  private final byte[] key;

  /**
   * Instantiates a new Device fingerprinter.
   *
   * @param key HMAC key, or null to disable fingerprinting
   */
  public DeviceFingerprinter(byte[] key) {
    this.key = key == null ? null : key.clone();
  }

  public boolean isEnabled() {
    return key != null;
  }

  /**
   * Computes the fingerprint.
   *
   * @param device device metadata, may be null
   * @return hex fingerprint, or null when disabled or no metadata was given
   */
  public String fingerprint(DeviceMetadata device) {
    if (key == null || device == null) {
      return null;
    }
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(key));
    update(hmac, device.ipAddress());
    update(hmac, device.userAgent());
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  // Length-prefixed so ("ab", "c") and ("a", "bc") differ.
  private static void update(HMac hmac, String value) {
    byte[] bytes = value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    int len = bytes.length;
    hmac.update((byte) (len >>> 24));
    hmac.update((byte) (len >>> 16));
    hmac.update((byte) (len >>> 8));
    hmac.update((byte) len);
    hmac.update(bytes, 0, len);
  }
}
