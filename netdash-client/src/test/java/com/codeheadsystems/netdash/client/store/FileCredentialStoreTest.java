package com.codeheadsystems.netdash.client.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.netdash.client.exceptions.CredentialStoreException;
import com.codeheadsystems.netdash.client.model.Credential;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCredentialStoreTest {

  private static final String TOKEN = "dyNYgfK0Ya6FWGqq83sBHa7TwzWo+pg4fDFUJHShcjVYzTfaRrZzm93p7OTAfH/0";
  private static final String MARKER = "pom.xml";

  private final ObjectMapper objectMapper = new ObjectMapper();

  @TempDir
  Path tempDir;

  private FileCredentialStore storeIn(Path workingDirectory, String credentialFile) {
    return new FileCredentialStore(objectMapper, credentialFile, MARKER, workingDirectory);
  }

  // ── resolvePath ───────────────────────────────────────────────────────────

  @Test
  void resolvePath_absolute_usedAsIs() {
    Path absolute = tempDir.resolve("elsewhere/token.json");
    FileCredentialStore store = storeIn(tempDir, absolute.toString());

    assertThat(store.resolvePath()).isEqualTo(absolute);
  }

  @Test
  void resolvePath_relative_resolvedAgainstAncestorWithMarker() throws Exception {
    Files.writeString(tempDir.resolve(MARKER), "<project/>");
    Path nested = Files.createDirectories(tempDir.resolve("module/target/classes"));

    FileCredentialStore store = storeIn(nested, "data/freebox_token.json");

    assertThat(store.resolvePath()).isEqualTo(tempDir.resolve("data/freebox_token.json"));
  }

  @Test
  void resolvePath_noMarker_fallsBackToWorkingDirectory() throws Exception {
    Path nested = Files.createDirectories(tempDir.resolve("a/b"));
    FileCredentialStore store = new FileCredentialStore(objectMapper, "token.json",
        "no-such-marker-" + System.nanoTime(), nested);

    assertThat(store.resolvePath()).isEqualTo(nested.resolve("token.json"));
  }

  @Test
  void resolvePath_markerBeyondSearchDepth_fallsBackToWorkingDirectory() throws Exception {
    Files.writeString(tempDir.resolve(MARKER), "<project/>");
    Path deep = tempDir;
    for (int i = 0; i < FileCredentialStore.MAX_ROOT_SEARCH_DEPTH; i++) {
      deep = deep.resolve("d" + i);
    }
    Files.createDirectories(deep);

    FileCredentialStore store = storeIn(deep, "token.json");

    assertThat(store.resolvePath()).isEqualTo(deep.resolve("token.json"));
  }

  // ── load / save / reset ───────────────────────────────────────────────────

  @Test
  void load_missingFile_returnsEmpty() {
    FileCredentialStore store = storeIn(tempDir, "token.json");

    assertThat(store.load()).isEmpty();
  }

  @Test
  void save_createsParentDirectoriesAndWritesAppToken() throws Exception {
    FileCredentialStore store = storeIn(tempDir, "data/nested/token.json");

    store.save(TOKEN);

    Path file = tempDir.resolve("data/nested/token.json");
    assertThat(file).exists();
    assertThat(objectMapper.readTree(file.toFile()).get("appToken").asText()).isEqualTo(TOKEN);
    assertThat(store.load()).map(Credential::appToken).contains(TOKEN);
  }

  @Test
  void save_thenNewStore_loadsSameToken() {
    storeIn(tempDir, "token.json").save(TOKEN);

    FileCredentialStore restarted = storeIn(tempDir, "token.json");

    assertThat(restarted.load()).map(Credential::appToken).contains(TOKEN);
  }

  @Test
  void reset_deletesFileAndIsIdempotent() {
    FileCredentialStore store = storeIn(tempDir, "token.json");
    store.save(TOKEN);

    store.reset();
    store.reset();

    assertThat(tempDir.resolve("token.json")).doesNotExist();
    assertThat(store.load()).isEmpty();
  }

  @Test
  void load_malformedFile_treatedAsNoCredential() throws Exception {
    Files.writeString(tempDir.resolve("token.json"), "{not json", StandardCharsets.UTF_8);

    assertThat(storeIn(tempDir, "token.json").load()).isEmpty();
  }

  @Test
  void load_blankToken_treatedAsNoCredential() throws Exception {
    Files.writeString(tempDir.resolve("token.json"), "{\"appToken\": \"  \"}", StandardCharsets.UTF_8);

    assertThat(storeIn(tempDir, "token.json").load()).isEmpty();
  }

  @Test
  void reload_picksUpFileWrittenElsewhere() throws Exception {
    FileCredentialStore store = storeIn(tempDir, "token.json");
    assertThat(store.load()).isEmpty();

    Files.writeString(tempDir.resolve("token.json"), "{\"appToken\": \"" + TOKEN + "\"}", StandardCharsets.UTF_8);

    assertThat(store.load()).isEmpty();
    assertThat(store.reload()).map(Credential::appToken).contains(TOKEN);
  }

  @Test
  void save_parentIsAFile_throwsCredentialStoreException() throws Exception {
    Files.writeString(tempDir.resolve("blocker"), "x");
    FileCredentialStore store = storeIn(tempDir, "blocker/token.json");

    assertThatThrownBy(() -> store.save(TOKEN))
        .isInstanceOf(CredentialStoreException.class)
        .hasMessageContaining("token.json");
  }
}
