package narrativeforge.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import narrativeforge.domain.dto.LayoutRequest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Peticiones de layout en JSON: captura de un caso concreto y su reproducción.
 * <p>
 * Solo maneja {@link LayoutRequest} (configuración + grafo de entrada). Los resultados
 * no se guardan: la persistencia de posiciones corresponde a la capa anfitriona.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: se reutiliza
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Las peticiones capturadas pueden llevar anotaciones propias (ej. "comment")
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Carga una petición de layout.
     *
     * @throws IOException Si el archivo no existe o su contenido no es una petición válida.
     */
    public LayoutRequest readRequest(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("La petición de layout no existe: " + file.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(file)) {
            LayoutRequest request = parse(in, file.toString());
            log.info("Petición de layout cargada de {}: {} nodos, {} aristas.",
                    file.getFileName(), request.nodes().size(), request.edges().size());
            return request;
        }
    }

    /**
     * Carga una petición desde un stream (por ejemplo, un recurso del classpath).
     */
    public LayoutRequest readRequest(InputStream in) throws IOException {
        if (in == null) {
            throw new IOException("Stream nulo para la petición de layout.");
        }
        return parse(in, "stream");
    }

    /**
     * Guarda una petición para poder reproducirla después. Crea los directorios necesarios.
     */
    public void writeRequest(LayoutRequest request, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), request);
        log.info("Petición de layout capturada en {} ({} nodos).", file.toAbsolutePath(), request.nodes().size());
    }

    private static LayoutRequest parse(InputStream in, String source) throws IOException {
        LayoutRequest request;
        try {
            request = objectMapper.readValue(in, LayoutRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Petición de layout mal formada en {}: {}", source, e.getOriginalMessage());
            throw e;
        }
        if (request == null) {
            throw new IOException("Petición de layout vacía en " + source);
        }
        return request;
    }
}
