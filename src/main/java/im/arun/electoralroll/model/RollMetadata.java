package im.arun.electoralroll.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document-level details printed in the roll header.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RollMetadata {

    @JsonProperty("assembly_constituency_no")
    private String assemblyConstituencyNo;

    @JsonProperty("assembly_constituency_name")
    private String assemblyConstituencyName;

    @JsonProperty("parliamentary_constituency_no")
    private String parliamentaryConstituencyNo;

    @JsonProperty("parliamentary_constituency_name")
    private String parliamentaryConstituencyName;

    @JsonProperty("part_no")
    private String partNo;

    @JsonProperty("district")
    private String district;

    @JsonProperty("pin_code")
    private String pinCode;

    /** State for a known district, otherwise the district itself. */
    @JsonProperty("region")
    private String region;

    /**
     * Copies every field that is set here and still unset on the target.
     */
    public void fillMissing(RollMetadata target) {
        if (target.assemblyConstituencyNo == null) target.assemblyConstituencyNo = assemblyConstituencyNo;
        if (target.assemblyConstituencyName == null) target.assemblyConstituencyName = assemblyConstituencyName;
        if (target.parliamentaryConstituencyNo == null) target.parliamentaryConstituencyNo = parliamentaryConstituencyNo;
        if (target.parliamentaryConstituencyName == null) target.parliamentaryConstituencyName = parliamentaryConstituencyName;
        if (target.partNo == null) target.partNo = partNo;
        if (target.district == null) target.district = district;
        if (target.pinCode == null) target.pinCode = pinCode;
        if (target.region == null) target.region = region;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return assemblyConstituencyNo == null && assemblyConstituencyName == null
            && parliamentaryConstituencyNo == null && parliamentaryConstituencyName == null
            && partNo == null && district == null && pinCode == null && region == null;
    }
}
