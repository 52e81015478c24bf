package jellyvr.core.model.heresphere;

import java.util.List;

/**
 * A user's library already reshaped for HereSphere: the index tabs and the
 * matching scan data.
 */
public record TranslatedLibrary(List<Library> libraries, Scan scan) {

    public TranslatedLibrary {
        libraries = libraries == null ? List.of() : List.copyOf(libraries);
        scan = scan == null ? new Scan(List.of()) : scan;
    }

    public int size() {
        return scan.scanData().size();
    }
}
