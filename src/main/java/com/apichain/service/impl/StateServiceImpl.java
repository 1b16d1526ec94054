package com.apichain.service.impl;

import com.apichain.exception.ApiChainException;
import com.apichain.model.ApiSpecification;
import com.apichain.model.OperationSequence;
import com.apichain.service.api.StateService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * A file-based implementation of the {@link StateService} that persists the application's state
 * to {@code <home>/.api-chain/state.json}.
 * <p>
 * Specifications, credentials and sequences are cached in memory and written through to the file on
 * every change. Credentials are encrypted with a {@link StringEncryptor} before they are stored in memory
 * or on disk. Sequences are stored per alias as a JSON document keyed by sequence id. All file I/O is
 * synchronized.
 */
@Service
@Slf4j
public class StateServiceImpl implements StateService {

    private final File stateFile;
    private Map<String, ApiSpecification> specifications = new ConcurrentHashMap<>();
    private Map<String, String> credentials = new ConcurrentHashMap<>();
    private Map<String, LinkedHashMap<String, OperationSequence>> sequences = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final StringEncryptor encryptor;

    /**
     * @param encryptor the encryptor provided by the Jasypt Spring Boot starter.
     * @param home      the directory under which {@code .api-chain/state.json} lives.
     */
    public StateServiceImpl(StringEncryptor encryptor, @Value("${api-chain.home}") String home) {
        this.encryptor = encryptor;
        this.stateFile = new File(home, ".api-chain/state.json");
    }

    /**
     * Loads the persisted state once the bean has been constructed.
     */
    @PostConstruct
    public void init() {
        loadState();
    }

    @Override
    public void saveSpecification(String alias, ApiSpecification spec) {
        specifications.put(alias, spec);
        saveState();
    }

    @Override
    public ApiSpecification getSpecification(String alias) {
        return specifications.get(alias);
    }

    @Override
    public Set<String> getAliases() {
        return new TreeSet<>(specifications.keySet());
    }

    @Override
    public void saveCredential(String alias, String token) {
        log.info("Encrypting and saving credential for alias '{}'", alias);
        credentials.put(alias, encryptor.encrypt(token));
        saveState();
    }

    /**
     * {@inheritDoc}
     * <p>
     * If decryption fails, which happens when the secret key has changed, an error is logged and
     * {@code null} is returned.
     */
    @Override
    public String getCredential(String alias) {
        String encryptedToken = credentials.get(alias);
        if (encryptedToken == null) {
            return null;
        }
        try {
            return encryptor.decrypt(encryptedToken);
        } catch (Exception e) {
            log.error("Could not decrypt credential for alias '{}'. The secret key may have changed or is incorrect.", alias);
            return null;
        }
    }

    @Override
    public int saveSequences(String alias, List<OperationSequence> generated, boolean overrideExisting) {
        LinkedHashMap<String, OperationSequence> stored;
        synchronized (this) {
            stored = overrideExisting
                    ? new LinkedHashMap<>()
                    : new LinkedHashMap<>(sequences.getOrDefault(alias, new LinkedHashMap<>()));
            int before = stored.size();
            generated.forEach(sequence -> stored.putIfAbsent(sequence.getId(), sequence));
            sequences.put(alias, stored);
            log.info("Stored {} new sequence(s) for alias '{}' ({} total, override={})",
                    stored.size() - before, alias, stored.size(), overrideExisting);
        }
        saveState();
        return stored.size();
    }

    @Override
    public List<OperationSequence> getSequences(String alias) {
        Map<String, OperationSequence> stored = sequences.get(alias);
        return stored == null ? List.of() : new ArrayList<>(stored.values());
    }

    private synchronized void saveState() {
        try {
            File parentDir = stateFile.getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }

            Map<String, Object> state = new HashMap<>();
            state.put("specifications", specifications);
            state.put("credentials", credentials);
            state.put("sequences", sequences);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(stateFile, state);
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save application state to {}", stateFile, e);
            throw new ApiChainException("Failed to save application state", e);
        }
    }

    /**
     * Reads the state file into memory. A missing file means a clean start; a file that cannot be parsed
     * is moved aside and the application starts clean.
     */
    private synchronized void loadState() {
        if (!stateFile.exists() || stateFile.length() == 0) {
            log.info("No state file found at {}, starting with a clean state.", stateFile);
            return;
        }
        try {
            Map<String, Object> state = objectMapper.readValue(stateFile, new TypeReference<HashMap<String, Object>>() {});
            if (state.get("specifications") != null) {
                this.specifications = objectMapper.convertValue(state.get("specifications"),
                        new TypeReference<ConcurrentHashMap<String, ApiSpecification>>() {});
            }
            if (state.get("credentials") != null) {
                this.credentials = objectMapper.convertValue(state.get("credentials"),
                        new TypeReference<ConcurrentHashMap<String, String>>() {});
            }
            if (state.get("sequences") != null) {
                this.sequences = objectMapper.convertValue(state.get("sequences"),
                        new TypeReference<ConcurrentHashMap<String, LinkedHashMap<String, OperationSequence>>>() {});
            }
            log.info("Successfully loaded state from {}", stateFile);
        } catch (Exception e) {
            log.warn("Could not load or parse state file at {}. A backup will be created, and the application will start with a fresh state. Error: {}",
                    stateFile, e.getMessage());
            backupCorruptedStateFile();
            this.specifications = new ConcurrentHashMap<>();
            this.credentials = new ConcurrentHashMap<>();
            this.sequences = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedStateFile() {
        File backupFile = new File(stateFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(stateFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted state file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted state file from {} to {}", stateFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }
}
