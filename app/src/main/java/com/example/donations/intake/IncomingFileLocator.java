package com.example.donations.intake;

import com.example.donations.config.DonationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class IncomingFileLocator {

    private static final Logger log = LoggerFactory.getLogger(IncomingFileLocator.class);

    private final Path incomingDirectory;
    private final String fileGlob;
    private final Path archiveDirectory;
    private final Path duplicatesDirectory;

    public IncomingFileLocator(DonationProperties properties) {
        this.incomingDirectory = Path.of(properties.getIntake().getDirectory());
        this.fileGlob = properties.getIntake().getFileGlob();
        this.archiveDirectory = Path.of(properties.getIntake().getArchiveDirectory());
        this.duplicatesDirectory = Path.of(properties.getIntake().getDuplicatesDirectory());
        log.info("IncomingFileLocator inicializado para o diretório: {} (padrão: {})", incomingDirectory, fileGlob);
    }

    /**
     * Lista os arquivos CSV pendentes no diretório de entrada, ordenados por nome.
     * Um diretório inexistente é tratado como entrada vazia.
     *
     * @return Os arquivos encontrados, ou uma lista vazia.
     * @throws IOException Se o diretório existir mas não puder ser lido.
     */
    public List<Path> listCsvFiles() throws IOException {
        if (!Files.isDirectory(incomingDirectory)) {
            log.info("Diretório de entrada {} não existe. Nenhum arquivo a processar.", incomingDirectory);
            return Collections.emptyList();
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(incomingDirectory, fileGlob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));

        if (files.isEmpty()) {
            log.info("Nenhum arquivo CSV encontrado em {}", incomingDirectory);
            return Collections.emptyList();
        }

        log.info("Encontrados {} arquivos CSV em {}: {}", files.size(), incomingDirectory,
                files.stream().map(path -> path.getFileName().toString()).collect(Collectors.joining(", ")));
        return files;
    }

    public InputStream openFile(Path file) throws IOException {
        log.debug("Abrindo arquivo {}", file);
        return Files.newInputStream(file);
    }

    /**
     * Move um arquivo já mesclado para o diretório de processados, para que não seja lido de novo.
     * Se já existir um arquivo com o mesmo nome lá, o novo recebe o horário atual como sufixo.
     *
     * @param file O arquivo a ser movido.
     * @return O novo caminho do arquivo.
     * @throws IOException Se ocorrer um erro ao mover o arquivo.
     */
    public Path archiveFile(Path file) throws IOException {
        return moveTo(archiveDirectory, file);
    }

    /**
     * Move um arquivo cujo conteúdo já foi mesclado antes para o diretório de duplicados.
     *
     * @param file O arquivo pulado.
     * @return O novo caminho do arquivo.
     * @throws IOException Se ocorrer um erro ao mover o arquivo.
     */
    public Path moveToDuplicates(Path file) throws IOException {
        return moveTo(duplicatesDirectory, file);
    }

    private Path moveTo(Path directory, Path file) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(file.getFileName());
        if (Files.exists(target)) {
            target = directory.resolve(file.getFileName() + "." + System.currentTimeMillis());
        }
        log.info("Movendo arquivo {} para {}.", file.getFileName(), target);
        Files.move(file, target);
        return target;
    }
}
