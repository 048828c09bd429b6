package mailflow.ledger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobKeysTest {

  @Test
  void sameCampaignAndAddressGiveSameKey() {
    assertEquals(JobKeys.of("c1", "a@x.com"), JobKeys.of("c1", "  A@X.com "));
  }

  @Test
  void differentCampaignsGiveDifferentKeys() {
    assertNotEquals(JobKeys.of("c1", "a@x.com"), JobKeys.of("c2", "a@x.com"));
  }

  @Test
  void keyIsLowerCaseSha256Hex() {
    String key = JobKeys.of("c1", "a@x.com");

    assertEquals(64, key.length());
    assertTrue(key.matches("[0-9a-f]+"));
  }
}
