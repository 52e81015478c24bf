package jellyvr.core.model.heresphere;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Scan(@JsonProperty("scanData") List<ScanData> scanData) {

    public Scan {
        scanData = scanData == null ? List.of() : List.copyOf(scanData);
    }
}
