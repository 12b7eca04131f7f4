package com.example.videocompare_backend.service.Interfaces;

import java.nio.file.Path;

public interface StorageService {
    /** Nieuw uniek pad in de scratch-map: random token + extensie. Het bestand bestaat nog niet. */
    Path newScratchFile(String extension);

    /** Map waarin de downloader zijn eigen bestanden neerzet. */
    Path downloadDir();

    Path scratchDir();

    /** Idempotent: een ontbrekend bestand is geen fout. */
    void delete(Path file);
}
