//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mapdb.BTreeKeySerializer;
import org.mapdb.BTreeMap;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import premise.extract.BatchWriter;
import premise.extract.CorpusWriter;
import premise.model.Decl;
import premise.model.ModuleData;

/**
 * A store backed by MapDB, either in memory or in a file. A file store persists an imported
 * corpus so that later extraction runs need not re-read the corpus dump.
 */
public class MapDBStore extends DeclStore {

  private static final Logger logger = LogManager.getLogger(MapDBStore.class);

  /** A writer that can be used to write declarations to this store. */
  public final CorpusWriter writer = new BatchWriter() {

    // commit every so many modules; keeps the WAL from getting too big
    private int _writeCount;
    private static final int COMMIT_EVERY = 100;

    @Override public void openSession () {
      _writeCount = 0;
    }

    @Override public void closeSession () {
      super.closeSession();
      _db.commit();
    }

    @Override protected void storeRoot (String module) {
      if (!_roots.containsValue(module)) _roots.put(_roots.size(), module);
    }

    @Override protected void storeModule (ModuleData module) {
      Integer moduleId = _moduleIds.get(module.name);
      if (moduleId == null) {
        moduleId = _moduleIds.size();
        _moduleIds.put(module.name, moduleId);
        _moduleNames.put(moduleId, module.name);
      } else {
        // a rewritten module replaces its previous declarations
        for (String old : IO.namesFromBytes(_moduleDecls.get(moduleId))) _declData.remove(old);
      }
      List<String> names = new ArrayList<>(module.decls.size());
      for (Decl decl : module.decls) {
        _declData.put(decl.name, IO.toBytes(decl));
        names.add(decl.name);
      }
      _moduleDecls.put(moduleId, IO.toBytes(names));
      _moduleImports.put(moduleId, IO.toBytes(module.imports));
      if (++_writeCount % COMMIT_EVERY == 0) _db.commit();
    }
  };

  /** Creates an in-memory store. */
  public MapDBStore (String name) {
    this(name, null, DBMaker.newMemoryDB());
  }

  /** Creates (or reopens) a store persisted at {@code store}. */
  public MapDBStore (String name, Path store) {
    this(name, store, DBMaker.newFileDB(store.toFile()).closeOnJvmShutdown());
  }

  /**
   * Wipes the contents of this store, preparing it to be rebuilt from scratch.
   */
  public void clear () {
    _declData.clear();
    _moduleIds.clear();
    _moduleNames.clear();
    _moduleDecls.clear();
    _moduleImports.clear();
    _roots.clear();
    _db.commit();
  }

  @Override public CorpusWriter writer () {
    return writer;
  }

  @Override public Optional<Decl> decl (String name) {
    byte[] data = _declData.get(name);
    return (data == null) ? Optional.empty() : Optional.of(IO.declFromBytes(data));
  }

  @Override public Optional<ModuleData> module (String name) {
    Integer moduleId = _moduleIds.get(name);
    if (moduleId == null) return Optional.empty();
    List<Decl> decls = new ArrayList<>();
    for (String dname : IO.namesFromBytes(_moduleDecls.get(moduleId))) {
      decls.add(decl(dname).orElseThrow(() -> new IllegalStateException(
        "Module " + name + " references missing declaration " + dname)));
    }
    return Optional.of(new ModuleData(name, imports(name), decls));
  }

  @Override public List<String> imports (String module) {
    Integer moduleId = _moduleIds.get(module);
    return (moduleId == null) ? new ArrayList<>() : IO.namesFromBytes(_moduleImports.get(moduleId));
  }

  @Override public boolean hasModule (String name) {
    return _moduleIds.containsKey(name);
  }

  @Override public List<String> moduleNames () {
    return new ArrayList<>(_moduleNames.values());
  }

  @Override public List<String> roots () {
    return new ArrayList<>(_roots.values());
  }

  @Override public int declCount () {
    return _declData.size();
  }

  @Override public void close () {
    _db.close();
  }

  private MapDBStore (String name, Path storePath, DBMaker<?> maker) {
    super(name);

    // if we're a persistent database, check our schema version and blow away the old db if the
    // schema is out of date; the store is a cache of a corpus dump, it can always be reimported
    if (storePath != null) {
      Path versFile = Paths.get(storePath.toString()+".v");
      int fileVers = 0;
      try {
        if (Files.exists(versFile)) {
          fileVers = Integer.parseInt(Files.readAllLines(versFile).get(0).trim());
        }
      } catch (IOException | RuntimeException e) {
        logger.warn("Error reading version from {}", versFile, e);
      }
      if (fileVers < SCHEMA_VERS) {
        String storeName = storePath.getFileName().toString();
        try {
          Path parent = storePath.toAbsolutePath().getParent();
          if (parent != null && Files.exists(parent)) {
            for (Path file : Files.list(parent).collect(Collectors.toList())) {
              String fname = file.getFileName().toString();
              if (fname.startsWith(storeName) && !file.equals(versFile)) Files.delete(file);
            }
          }
          Files.write(versFile, Arrays.asList(String.valueOf(SCHEMA_VERS)));
        } catch (IOException ioe) {
          throw new IllegalStateException("Unable to reset stale store " + storePath, ioe);
        }
      }
    }

    _db = maker.make();
    _declData = createTreeMap("decls", BTreeKeySerializer.STRING, Serializer.BYTE_ARRAY);
    _moduleIds = createTreeMap("moduleIds", BTreeKeySerializer.STRING, Serializer.INTEGER);
    _moduleNames = createTreeMap(
      "moduleNames", BTreeKeySerializer.ZERO_OR_POSITIVE_INT, Serializer.STRING);
    _moduleDecls = createTreeMap(
      "moduleDecls", BTreeKeySerializer.ZERO_OR_POSITIVE_INT, Serializer.BYTE_ARRAY);
    _moduleImports = createTreeMap(
      "moduleImports", BTreeKeySerializer.ZERO_OR_POSITIVE_INT, Serializer.BYTE_ARRAY);
    _roots = createTreeMap("roots", BTreeKeySerializer.ZERO_OR_POSITIVE_INT, Serializer.STRING);
  }

  private <K,V> BTreeMap<K,V> createTreeMap (String name, BTreeKeySerializer<K> keySz,
                                             Serializer<V> valSz) {
    return _db.createTreeMap(name).keySerializer(keySz).valueSerializer(valSz).makeOrGet();
  }

  private final DB _db;

  private final BTreeMap<String,byte[]> _declData;
  private final BTreeMap<String,Integer> _moduleIds;
  private final BTreeMap<Integer,String> _moduleNames;
  private final BTreeMap<Integer,byte[]> _moduleDecls;
  private final BTreeMap<Integer,byte[]> _moduleImports;
  private final BTreeMap<Integer,String> _roots;

  private static final int SCHEMA_VERS = 1;
}
