package com.aiadvent.ci.command;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.ci.budget.FileChange;
import com.aiadvent.ci.config.CiAssistantProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceFileFilterTest {

  private final CiAssistantProperties.TestDraft defaults = new CiAssistantProperties.TestDraft();
  private final SourceFileFilter filter =
      new SourceFileFilter(
          defaults.getIncludePatterns(),
          defaults.getExcludePatterns(),
          defaults.getRequiredExtension());

  @Test
  void acceptsPythonSourcesUnderSrc() {
    assertThat(filter.accepts("src/app.py")).isTrue();
    assertThat(filter.accepts("src/pkg/service/users.py")).isTrue();
  }

  @Test
  void rejectsTestsVirtualenvsAndOtherFiles() {
    assertThat(filter.accepts("src/pkg/test_users.py")).isFalse();
    assertThat(filter.accepts("src/tests/helpers.py")).isFalse();
    assertThat(filter.accepts("src/.venv/lib/site.py")).isFalse();
    assertThat(filter.accepts("src/pkg/__pycache__/mod.py")).isFalse();
    assertThat(filter.accepts("src/conftest.py")).isFalse();
    assertThat(filter.accepts("src/README.md")).isFalse();
    assertThat(filter.accepts("tools/script.py")).isFalse();
    assertThat(filter.accepts("src/data.json")).isFalse();
  }

  @Test
  void keepsListingOrder() {
    List<FileChange> files =
        List.of(
            new FileChange("src/b.py", "modified", 1, 0, "+x"),
            new FileChange("docs/index.md", "modified", 1, 0, "+y"),
            new FileChange("src/a.py", "added", 2, 0, "+z"));

    assertThat(filter.filter(files)).extracting(FileChange::path).containsExactly("src/b.py", "src/a.py");
  }
}
