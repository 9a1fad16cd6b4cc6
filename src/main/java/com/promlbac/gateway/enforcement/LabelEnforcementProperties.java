package com.promlbac.gateway.enforcement;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties("lbac.enforcement")
public class LabelEnforcementProperties {

    /**
     * Path patterns that are passed through without an identity token. These requests never get label values.
     */
    private List<String> unprotectedPaths = new ArrayList<>(List.of("/actuator/**"));
}
