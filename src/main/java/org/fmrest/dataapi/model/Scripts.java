package org.fmrest.dataapi.model;

import lombok.Data;

/**
 * Scripts to run around a record request.
 * <p>
 * {@code prerequest} runs before the request is processed, {@code presort} before the
 * foundset is sorted, {@code after} once the request completed. Any of them may be null.
 * </p>
 */
@Data
public class Scripts {
    private String prerequest;
    private String prerequestParam;
    private String presort;
    private String presortParam;
    private String after;
    private String afterParam;

    public static Scripts after(String name, String param) {
        Scripts scripts = new Scripts();
        scripts.setAfter(name);
        scripts.setAfterParam(param);
        return scripts;
    }

    public static Scripts prerequest(String name, String param) {
        Scripts scripts = new Scripts();
        scripts.setPrerequest(name);
        scripts.setPrerequestParam(param);
        return scripts;
    }
}
