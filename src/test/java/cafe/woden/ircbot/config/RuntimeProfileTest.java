package cafe.woden.ircbot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class RuntimeProfileTest {

  @Test
  void whitelistIsCaseInsensitive() {
    RuntimeProfile profile = profile(List.of("~Admin@Staff.Example"));

    assertTrue(profile.isWhitelisted("~admin@staff.example"));
    assertFalse(profile.isWhitelisted("~other@staff.example"));
    assertFalse(profile.isWhitelisted(""));
  }

  @Test
  void whitelistEditsDoNotDuplicate() {
    RuntimeProfile profile = profile(List.of());

    profile.whitelistAdd("a@h");
    profile.whitelistAdd("A@H");
    assertEquals(List.of("a@h"), profile.whitelist());

    profile.whitelistRemove("A@h");
    assertTrue(profile.whitelist().isEmpty());
  }

  @Test
  void nicknameChangesAreVisibleAndBlankIsIgnored() {
    RuntimeProfile profile = profile(List.of());

    profile.setNickname("cafebot_");
    profile.setNickname("  ");

    assertEquals("cafebot_", profile.nickname());
    assertTrue(profile.isNick("CAFEBOT_"));
  }

  private static RuntimeProfile profile(List<String> whitelist) {
    BotProperties.Profile p =
        new BotProperties.Profile(
            "irc.example.net:6667",
            "cafebot",
            null,
            null,
            null,
            "!",
            whitelist,
            false,
            null,
            null,
            null,
            null);
    return new RuntimeProfile(new BotProperties(p, null, null));
  }
}
