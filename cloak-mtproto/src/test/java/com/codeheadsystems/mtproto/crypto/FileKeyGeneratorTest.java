package com.codeheadsystems.mtproto.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.mtproto.common.RandomProvider;
import com.codeheadsystems.mtproto.exceptions.CipherException;
import com.codeheadsystems.mtproto.exceptions.KeyFingerprintMismatchException;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FileKeyGeneratorTest {

  private FileKeyGenerator generator;

  @BeforeEach
  void setUp() {
    generator = new FileKeyGenerator(new RandomProvider());
  }

  private static byte[] sequence(int start, int length) {
    byte[] out = new byte[length];
    for (int i = 0; i < length; i++) {
      out[i] = (byte) (start + i);
    }
    return out;
  }

  @Test
  void fingerprint_knownAnswer() {
    // md5(00..3f) folded and read little-endian, computed independently
    assertThat(FileKeyGenerator.fingerprint(sequence(0, 32), sequence(32, 32))).isEqualTo(-217561997);
  }

  @Test
  void fingerprint_isDeterministic() {
    FileKeyMaterial material = generator.generate();
    assertThat(FileKeyGenerator.fingerprint(material.key(), material.iv()))
        .isEqualTo(material.fingerprint())
        .isEqualTo(FileKeyGenerator.fingerprint(material.key().clone(), material.iv().clone()));
  }

  @Test
  void fingerprint_changesWhenAnyBitFlips() {
    byte[] key = sequence(0, 32);
    byte[] iv = sequence(32, 32);
    int original = FileKeyGenerator.fingerprint(key, iv);
    Set<Integer> seen = new HashSet<>();
    for (int bit = 0; bit < 512; bit++) {
      byte[] k = key.clone();
      byte[] v = iv.clone();
      byte[] target = bit < 256 ? k : v;
      target[(bit % 256) / 8] ^= (byte) (1 << (bit % 8));
      int flipped = FileKeyGenerator.fingerprint(k, v);
      assertThat(flipped).as("bit %d", bit).isNotEqualTo(original);
      seen.add(flipped);
    }
    assertThat(seen).hasSizeGreaterThan(500);
  }

  @Test
  void generate_producesFreshMaterial() {
    FileKeyMaterial first = generator.generate();
    FileKeyMaterial second = generator.generate();

    assertThat(first.key()).hasSize(32);
    assertThat(first.iv()).hasSize(32);
    assertThat(first.key()).isNotEqualTo(second.key());
    assertThat(first.iv()).isNotEqualTo(second.iv());
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 16, 33, 100_000})
  void encryptFile_thenDecrypt_recoversOriginal(int size) {
    byte[] data = new RandomProvider().randomBytes(size);

    EncryptedFile encrypted = generator.encryptFile(data);

    assertThat(encrypted.plaintextSize()).isEqualTo(size);
    assertThat(encrypted.ciphertext().length % 16).isZero();
    assertThat(encrypted.ciphertext().length).isBetween(size, size + 15);
    assertThat(FileKeyGenerator.decryptFile(encrypted.ciphertext(), encrypted.keyMaterial(),
        encrypted.keyMaterial().fingerprint(), size))
        .isEqualTo(data);
  }

  @Test
  void decryptFile_wrongIv_raisesFingerprintMismatch() {
    EncryptedFile encrypted = generator.encryptFile("secret video".getBytes());
    FileKeyMaterial material = encrypted.keyMaterial();
    byte[] wrongIv = material.iv().clone();
    wrongIv[0] ^= 0x01;

    assertThatThrownBy(() -> FileKeyGenerator.decryptFile(
        encrypted.ciphertext(), material.key(), wrongIv, material.fingerprint()))
        .isInstanceOf(KeyFingerprintMismatchException.class)
        .satisfies(e -> {
          KeyFingerprintMismatchException mismatch = (KeyFingerprintMismatchException) e;
          assertThat(mismatch.expected()).isEqualTo(material.fingerprint());
          assertThat(mismatch.actual()).isEqualTo(FileKeyGenerator.fingerprint(material.key(), wrongIv));
        });
  }

  @Test
  void decryptFile_wrongFingerprint_raisesMismatch() {
    EncryptedFile encrypted = generator.encryptFile(new byte[64]);
    FileKeyMaterial material = encrypted.keyMaterial();

    assertThatThrownBy(() -> FileKeyGenerator.decryptFile(
        encrypted.ciphertext(), material.key(), material.iv(), material.fingerprint() + 1))
        .isInstanceOf(KeyFingerprintMismatchException.class);
  }

  @Test
  void decryptFile_receivedIvDiffersFromFingerprintedOne() {
    EncryptedFile encrypted = generator.encryptFile(new byte[64]);
    FileKeyMaterial sent = encrypted.keyMaterial();
    byte[] receivedIv = sent.iv().clone();
    receivedIv[31] ^= (byte) 0x80;
    FileKeyMaterial received = FileKeyMaterial.of(sent.key(), receivedIv);

    assertThatThrownBy(() -> FileKeyGenerator.decryptFile(encrypted.ciphertext(), received, sent.fingerprint(), 64))
        .isInstanceOf(KeyFingerprintMismatchException.class);
  }

  @Test
  void decryptFile_sizeLargerThanCiphertext_isRejected() {
    EncryptedFile encrypted = generator.encryptFile(new byte[10]);

    assertThatThrownBy(() -> FileKeyGenerator.decryptFile(encrypted.ciphertext(), encrypted.keyMaterial(),
        encrypted.keyMaterial().fingerprint(), 17))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void keyMaterial_wrongSizes_areRejected() {
    assertThatThrownBy(() -> new FileKeyMaterial(new byte[16], new byte[32], 0))
        .isInstanceOf(CipherException.class);
    assertThatThrownBy(() -> FileKeyMaterial.of(new byte[32], new byte[31]))
        .isInstanceOf(CipherException.class);
  }

  @Test
  void keyMaterial_destroy_zeroesKeyAndIv() {
    FileKeyMaterial material = generator.generate();

    material.destroy();

    assertThat(material.key()).containsOnly(0);
    assertThat(material.iv()).containsOnly(0);
    assertThat(material.toString()).doesNotContain("key=");
  }
}
