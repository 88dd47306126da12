package com.dimosr.cache.persistence;

import com.dimosr.cache.ForwardingCacheable;
import com.dimosr.cache.KeyValueStore;
import com.google.common.collect.Maps;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A cache that can store its contents on disk, as a JSON object in the file {@code <directory>/<name>}.
 *
 * The contents are loaded from the file (if it exists) when the cache is created,
 * and written to it whenever {@link #save()} is called. Between saves the cache only lives in memory.
 *
 * Durability is best effort: a file that cannot be read or parsed at load time is skipped,
 * so the cache starts empty. Failures to save or delete the file are propagated to the caller.
 *
 * @param <V> the type of the values, which must be serializable by Gson
 */
public class PersistableCache<V> extends ForwardingCacheable<String, V> {
    private static final Logger log = LoggerFactory.getLogger(PersistableCache.class);

    private final String name;
    private final Path file;
    private final Type fileType;
    private final Gson gson;
    private final KeyValueStore<String, V> store;

    private final Lock fileLock = new ReentrantLock();

    public PersistableCache(final String name, final Path directory, final Class<V> valueType) {
        this(name, directory, TypeToken.get(valueType), new GsonBuilder().create());
    }

    /**
     * @param name the name of the cache, used as the file name
     * @param directory the directory of the file
     * @param valueType the type of the values, used to deserialize them
     * @param gson the Gson instance used to convert the contents from and to JSON
     */
    public PersistableCache(final String name, final Path directory, final TypeToken<V> valueType, final Gson gson) {
        this.name = checkNotNull(name, "name");
        this.file = checkNotNull(directory, "directory").resolve(name);
        this.fileType = TypeToken.getParameterized(Map.class, String.class, valueType.getType()).getType();
        this.gson = checkNotNull(gson, "gson");
        this.store = new KeyValueStore<>(load());
    }

    @Override
    protected KeyValueStore<String, V> delegate() {
        return store;
    }

    @Override
    public PersistableCache<V> require(final String key) {
        super.require(key);
        return this;
    }

    @Override
    public PersistableCache<V> require(final Set<String> keys) {
        super.require(keys);
        return this;
    }

    /**
     * Writes a snapshot of the contents to the file, replacing its previous contents
     *
     * @throws IOException if the file cannot be written
     */
    public void save() throws IOException {
        fileLock.lock();
        try {
            Map<String, V> snapshot = store.allValues();
            Path directory = file.toAbsolutePath().getParent();
            if(directory != null) {
                Files.createDirectories(directory);
            }
            try(Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                gson.toJson(snapshot, fileType, writer);
            }
            log.info("{}: Saved {} entries to {}", name, snapshot.size(), file);
        } finally {
            fileLock.unlock();
        }
    }

    /**
     * Deletes the file. The contents in memory are not affected.
     *
     * @throws IOException if the file does not exist or cannot be deleted
     */
    public void delete() throws IOException {
        fileLock.lock();
        try {
            Files.delete(file);
            log.info("{}: Deleted {}", name, file);
        } finally {
            fileLock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public Path getFile() {
        return file;
    }

    private Map<String, V> load() {
        if(!Files.exists(file)) {
            return Maps.newHashMap();
        }

        try(Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, V> persisted = gson.fromJson(reader, fileType);
            if(persisted == null) {
                return Maps.newHashMap();
            }
            Map<String, V> values = Maps.newHashMap(Maps.filterValues(persisted, value -> value != null));
            log.info("{}: Loaded {} entries from {}", name, values.size(), file);
            return values;
        } catch(IOException | JsonParseException e) {
            log.warn("{}: Could not load {}, starting with an empty cache", name, file, e);
            return Maps.newHashMap();
        }
    }
}
