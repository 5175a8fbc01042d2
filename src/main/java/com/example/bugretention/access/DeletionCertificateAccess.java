package com.example.bugretention.access;

import com.example.bugretention.models.DeletionCertificate;
import java.util.Optional;

public interface DeletionCertificateAccess {

    /**
     * Stages the certificate inside {@code tx} so it is persisted atomically with the deletes it
     * certifies.
     */
    void save(WriteContext tx, DeletionCertificate certificate);

    Optional<DeletionCertificate> findById(String certificateId);
}
