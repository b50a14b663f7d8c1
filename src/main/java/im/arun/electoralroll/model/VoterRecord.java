package im.arun.electoralroll.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One extracted voter. Immutable; fields that were not recovered are absent from the map.
 * A record always carries a name or a serial number.
 */
@ToString
@EqualsAndHashCode
public final class VoterRecord {

    @JsonProperty("fields")
    private final Map<VoterField, String> fields;

    @JsonProperty("page")
    private final Integer pageIndex;

    private VoterRecord(Map<VoterField, String> fields, Integer pageIndex) {
        this.fields = Collections.unmodifiableMap(new EnumMap<>(fields));
        this.pageIndex = pageIndex;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(VoterField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(VoterField field) {
        return fields.containsKey(field);
    }

    public Map<VoterField, String> getFields() {
        return fields;
    }

    public Integer getPageIndex() {
        return pageIndex;
    }

    /**
     * Identity used for de-duplication within a page: lower-cased name plus serial number.
     */
    @JsonIgnore
    public String identityKey() {
        String name = get(VoterField.NAME).map(n -> n.toLowerCase(Locale.ROOT)).orElse("");
        String serial = get(VoterField.SERIAL_NO).orElse("");
        return name + "|" + serial;
    }

    public static final class Builder {
        private final Map<VoterField, String> fields = new EnumMap<>(VoterField.class);
        private Integer pageIndex;

        private Builder() {
        }

        /**
         * Sets a field. Null or blank values are ignored so absent stays absent.
         */
        public Builder field(VoterField field, String value) {
            if (value != null && !value.isBlank()) {
                fields.put(field, value.strip());
            }
            return this;
        }

        public Builder pageIndex(Integer pageIndex) {
            this.pageIndex = pageIndex;
            return this;
        }

        public boolean has(VoterField field) {
            return fields.containsKey(field);
        }

        public boolean hasIdentity() {
            return fields.containsKey(VoterField.NAME) || fields.containsKey(VoterField.SERIAL_NO);
        }

        public int fieldCount() {
            return fields.size();
        }

        /**
         * @return the record, or empty when neither name nor serial number was set
         */
        public Optional<VoterRecord> build() {
            if (!hasIdentity()) {
                return Optional.empty();
            }
            return Optional.of(new VoterRecord(fields, pageIndex));
        }
    }
}
