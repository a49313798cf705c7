//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.*;
import org.junit.rules.TemporaryFolder;
import picocli.CommandLine;
import static org.junit.Assert.*;

public class ExtractPremisesTest {

  @Rule public TemporaryFolder temp = new TemporaryFolder();

  static final List<String> DUMP = Arrays.asList(
    "root Mathlib",
    "module Mathlib",
    "import Mathlib.Basic",
    "end",
    "module Init",
    "decl INDUCTIVE Nat",
    "type (sort 1)",
    "decl CONSTRUCTOR Nat.zero",
    "type (const Nat)",
    "decl INDUCTIVE Eq",
    "type (pi a (const Nat) (pi b (const Nat) (sort 0)))",
    "decl CONSTRUCTOR Eq.refl",
    "type (pi a (const Nat) (app (const Eq) (bvar 0) (bvar 0)))",
    "end",
    "module Mathlib.Basic",
    "import Init",
    "decl THEOREM zero_eq 1 2",
    "type (app (const Eq) (const Nat.zero) (const Nat.zero))",
    "value (app (const Eq.refl) (const Nat.zero))",
    "decl THEOREM zero_eq._proof_1",
    "type (app (const Eq) (const Nat.zero) (const Nat.zero))",
    "value (app (const Eq.refl) (const Nat.zero))",
    "decl THEOREM n_eq",
    "type (pi n (const Nat) (app (const Eq) (bvar 0) (bvar 0)))",
    "value (lam n (const Nat) (app (const Eq.refl) (bvar 0)))",
    "end");

  Path dump, labels, features;

  @Before public void setUp () throws Exception {
    dump = temp.getRoot().toPath().resolve("corpus.txt");
    Files.write(dump, DUMP, StandardCharsets.UTF_8);
    labels = temp.getRoot().toPath().resolve("labels.txt");
    features = temp.getRoot().toPath().resolve("features.txt");
  }

  int run (String... args) {
    return new CommandLine(new ExtractPremises()).execute(args);
  }

  List<String> read (Path path) throws Exception {
    return Files.readAllLines(path, StandardCharsets.UTF_8);
  }

  @Test public void testExtract () throws Exception {
    assertEquals(0, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString()));
    assertEquals(Arrays.asList("Eq.refl", "Eq.refl"), read(labels));
    assertEquals(Arrays.asList("T:Eq T:Nat.zero T:Eq(Nat.zero,Nat.zero)",
                               "T:Eq T:Eq(*,*)"), read(features));
  }

  @Test public void testFeatureAndDepthOptions () throws Exception {
    // n_eq's proof has depth 2, zero_eq's depth 1
    assertEquals(0, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString(), "--min-depth", "2",
                        "--features", "bigrams"));
    assertEquals(Arrays.asList("Eq.refl"), read(labels));
    assertEquals(Arrays.asList(""), read(features));
  }

  @Test public void testUserFilterWithoutSources () throws Exception {
    // anything but "true" is false, so only the second run filters
    assertEquals(0, run(labels.toString(), features.toString(), "yes", "TRUE",
                        "--corpus", dump.toString()));
    assertEquals(2, read(labels).size());
    assertEquals(0, run(labels.toString(), features.toString(), "false", "true",
                        "--corpus", dump.toString()));
    assertEquals(2, read(labels).size());
  }

  @Test public void testUserFilterWithSources () throws Exception {
    Path root = temp.newFolder("src").toPath();
    Path source = root.resolve("Mathlib/Basic.lean");
    Files.createDirectories(source.getParent());
    Files.write(source, Arrays.asList("theorem zero_eq : 0 = 0 := Eq.refl 0"),
                StandardCharsets.UTF_8);
    assertEquals(0, run(labels.toString(), features.toString(), "false", "true",
                        "--corpus", dump.toString(), "--source-root", root.toString()));
    // n_eq records no source lines, so none of its premises are mentioned
    assertEquals(Arrays.asList("Eq.refl"), read(labels));
    assertEquals(1, read(features).size());
  }

  @Test public void testSingleModule () throws Exception {
    assertEquals(0, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString(), "--module", "Init"));
    assertTrue(read(labels).isEmpty());
    assertTrue(read(features).isEmpty());
    assertEquals(1, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString(), "--module", "Nope"));
  }

  @Test public void testImportAndReuseStore () throws Exception {
    Path store = temp.getRoot().toPath().resolve("corpus.db");
    assertEquals(0, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString(), "--import-to", store.toString()));
    List<String> fromDump = read(labels);

    Files.delete(dump);
    assertEquals(0, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", store.toString()));
    assertEquals(fromDump, read(labels));
  }

  @Test public void testTruncatesOutputs () throws Exception {
    Files.write(labels, Arrays.asList("a", "b", "c", "d"), StandardCharsets.UTF_8);
    assertEquals(0, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString(), "--target", "Other"));
    assertTrue(read(labels).isEmpty());
  }

  @Test public void testFailedLoadTruncatesOutputs () throws Exception {
    Files.write(labels, Arrays.asList("stale"), StandardCharsets.UTF_8);
    Files.write(features, Arrays.asList("stale"), StandardCharsets.UTF_8);
    Files.write(dump, Arrays.asList("module A", "bogus"), StandardCharsets.UTF_8);
    assertEquals(1, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString()));
    assertTrue(read(labels).isEmpty());
    assertTrue(read(features).isEmpty());
  }

  @Test public void testFailures () throws Exception {
    // no corpus
    assertEquals(1, run(labels.toString(), features.toString(), "false", "false"));
    // missing corpus file
    assertEquals(1, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", temp.getRoot().toPath().resolve("nope.txt").toString()));
    // malformed corpus
    Files.write(dump, Arrays.asList("module A", "bogus"), StandardCharsets.UTF_8);
    assertEquals(1, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString()));
    // bad option values
    assertEquals(1, run(labels.toString(), features.toString(), "false", "false",
                        "--corpus", dump.toString(), "--features", "trigrams"));
    // missing positional arguments are a usage error
    assertNotEquals(0, run(labels.toString()));
  }
}
