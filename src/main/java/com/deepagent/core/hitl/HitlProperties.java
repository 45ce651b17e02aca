package com.deepagent.core.hitl;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "deepagent.hitl")
public class HitlProperties {

    /** Tools that pause for review when a session has approval enabled. */
    private List<String> gatedTools = new ArrayList<>(List.of("write_file", "edit_file", "execute"));
    private List<DecisionType> allowedDecisions =
            new ArrayList<>(List.of(DecisionType.APPROVE, DecisionType.REJECT, DecisionType.EDIT));

    public List<String> getGatedTools() { return gatedTools; }
    public void setGatedTools(List<String> gatedTools) { this.gatedTools = gatedTools; }
    public List<DecisionType> getAllowedDecisions() { return allowedDecisions; }
    public void setAllowedDecisions(List<DecisionType> allowedDecisions) { this.allowedDecisions = allowedDecisions; }
}
