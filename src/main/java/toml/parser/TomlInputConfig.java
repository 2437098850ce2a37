package toml.parser;

import lombok.Builder;
import lombok.Data;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.Reader;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class TomlInputConfig {

    @Builder.Default
    private boolean allowEmptyValues = true;

    @Builder.Default
    private boolean allowNullValues = true;

    @Builder.Default
    private boolean allowEmptyToml = true;

    public static TomlInputConfig defaults() {
        return TomlInputConfig.builder().build();
    }

    public static TomlInputConfig load(Reader reader) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object raw = yaml.load(reader);
        TomlInputConfig config = defaults();
        if (raw == null) {
            return config;
        }
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Parser configuration must be a YAML mapping, got: " + raw);
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            String key = String.valueOf(entry.getKey());
            boolean value = toBoolean(key, entry.getValue());
            switch (key) {
                case "allowEmptyValues":
                    config.setAllowEmptyValues(value);
                    break;
                case "allowNullValues":
                    config.setAllowNullValues(value);
                    break;
                case "allowEmptyToml":
                    config.setAllowEmptyToml(value);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown parser option <" + key + ">");
            }
        }
        return config;
    }

    private static boolean toBoolean(String key, Object value) {
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("Parser option <" + key + "> must be true or false, got: " + value);
        }
        return (Boolean) value;
    }
}
