package heatstress.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import heatstress.compute.EngineSettings;
import heatstress.io.dto.MeteoDataset;
import heatstress.io.dto.WbgtDataset;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

/**
 * Frontera JSON del motor: dataset meteorológico de entrada, configuración y dataset WBGT de salida.
 * <p>
 * El mapper es estricto: una propiedad desconocida o un {@code null} en un campo primitivo
 * es un error de formato, no un cero silencioso.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Lee el dataset de entrada y comprueba que los ejes coinciden con la forma de la rejilla.
     *
     * @throws IOException Si el fichero no existe, no se puede parsear o los ejes no encajan.
     */
    public MeteoDataset readDataset(String filePath) throws IOException {
        Path path = existingPath(filePath);
        log.info("Leyendo dataset meteorológico {}", path);

        MeteoDataset dataset = read(path, MeteoDataset.class);
        if (dataset.steps() == null || dataset.steps().isEmpty()) {
            throw new IOException("El dataset " + path + " no contiene pasos de tiempo.");
        }
        validateAxes(dataset, path);

        log.info("Dataset con {} pasos de tiempo.", dataset.steps().size());
        return dataset;
    }

    /**
     * Lee la configuración del motor. Cada sección y cada campo ausente del fichero conserva
     * el valor estándar: el documento se fusiona campo a campo sobre {@link EngineSettings#defaults()}.
     *
     * @throws IOException Si el fichero no existe, tiene claves desconocidas o valores fuera de rango.
     */
    public EngineSettings readSettings(String filePath) throws IOException {
        Path path = existingPath(filePath);
        log.info("Leyendo configuración {}", path);

        JsonNode overrides = read(path, JsonNode.class);
        if (overrides == null || !overrides.isObject()) {
            throw new IOException("La configuración " + path + " debe ser un objeto JSON.");
        }

        ObjectNode merged = objectMapper.valueToTree(EngineSettings.defaults());
        mergeInto(merged, (ObjectNode) overrides);

        try {
            return objectMapper.treeToValue(merged, EngineSettings.class);
        } catch (JsonProcessingException e) {
            log.error("Configuración inválida en {}: {}", path, e.getOriginalMessage());
            throw e;
        }
    }

    public WbgtDataset readResult(String filePath) throws IOException {
        return read(existingPath(filePath), WbgtDataset.class);
    }

    /**
     * Escribe el dataset WBGT. Si el archivo existe, se sobrescribe; los directorios se crean.
     */
    public void writeResult(WbgtDataset dataset, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Escribiendo {} pasos de WBGT en {}", dataset.steps().size(), path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), dataset);
        } catch (IOException e) {
            log.error("Error al escribir el dataset WBGT en {}", path, e);
            throw e;
        }
    }

    // Las secciones anidadas se fusionan recursivamente; el resto de valores sustituye al estándar.
    private static void mergeInto(ObjectNode base, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode current = base.get(field.getKey());
            if (current instanceof ObjectNode currentSection && field.getValue() instanceof ObjectNode overrideSection) {
                mergeInto(currentSection, overrideSection);
            } else {
                base.set(field.getKey(), field.getValue());
            }
        }
    }

    private static void validateAxes(MeteoDataset dataset, Path path) throws IOException {
        MeteoDataset.Step first = dataset.steps().get(0);
        if (first.airTemperature() == null) {
            return; // DatasetMapper informa de la variable ausente
        }
        int rows = first.airTemperature().length;
        int cols = rows == 0 ? 0 : first.airTemperature()[0].length;

        if (dataset.latitudes() != null && dataset.latitudes().length != rows) {
            throw new IOException(String.format("%s: %d latitudes para %d filas.", path, dataset.latitudes().length, rows));
        }
        if (dataset.longitudes() != null && dataset.longitudes().length != cols) {
            throw new IOException(String.format("%s: %d longitudes para %d columnas.", path, dataset.longitudes().length, cols));
        }
    }

    private static Path existingPath(String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }
        return path;
    }

    private static <T> T read(Path path, Class<T> type) throws IOException {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("Error al leer o parsear {} como {}", path, type.getSimpleName(), e);
            throw e;
        }
    }
}
