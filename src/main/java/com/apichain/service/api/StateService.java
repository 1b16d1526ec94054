package com.apichain.service.api;

import com.apichain.model.ApiSpecification;
import com.apichain.model.OperationSequence;
import java.util.List;
import java.util.Set;

/**
 * Persists learned specifications, their credentials and their generated sequences, keyed by API alias.
 */
public interface StateService {

    /**
     * Saves or replaces the specification stored under {@code alias}.
     */
    void saveSpecification(String alias, ApiSpecification spec);

    /**
     * @return the specification, or {@code null} if none is stored under {@code alias}.
     */
    ApiSpecification getSpecification(String alias);

    Set<String> getAliases();

    /**
     * Saves a credential for {@code alias}. The credential is encrypted before it is stored.
     */
    void saveCredential(String alias, String token);

    /**
     * @return the decrypted credential, or {@code null} if none is stored or it cannot be decrypted.
     */
    String getCredential(String alias);

    /**
     * Stores generated sequences for {@code alias}.
     *
     * @param overrideExisting when {@code true}, all previously stored sequences of the alias are discarded;
     *                         otherwise sequences are merged by id and existing ids are kept.
     * @return the number of sequences stored for the alias afterwards.
     */
    int saveSequences(String alias, List<OperationSequence> sequences, boolean overrideExisting);

    /**
     * @return the stored sequences of {@code alias} in insertion order; empty if there are none.
     */
    List<OperationSequence> getSequences(String alias);
}
