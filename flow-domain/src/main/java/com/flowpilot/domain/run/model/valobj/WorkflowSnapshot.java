package com.flowpilot.domain.run.model.valobj;

import com.flowpilot.domain.agent.model.entity.AgentDefinitionEntity;
import com.flowpilot.domain.workflow.model.valobj.WorkflowGraph;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 运行启动时冻结的工作流图与其引用的 Agent 定义
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowSnapshot {

    private WorkflowGraph graph;

    private List<AgentDefinitionEntity> agents = new ArrayList<>();

    /**
     * 按节点参数中的 agentId 或 agentName 查找 Agent。
     */
    public AgentDefinitionEntity findAgent(Object agentId, Object agentName) {
        if (agents == null) {
            return null;
        }
        if (agentId != null) {
            long id = NumberUtils.toLong(String.valueOf(agentId).trim(), -1L);
            for (AgentDefinitionEntity agent : agents) {
                if (agent != null && agent.getId() != null && agent.getId() == id) {
                    return agent;
                }
            }
        }
        if (agentName != null && StringUtils.isNotBlank(String.valueOf(agentName))) {
            String name = String.valueOf(agentName).trim();
            for (AgentDefinitionEntity agent : agents) {
                if (agent != null && name.equals(agent.getName())) {
                    return agent;
                }
            }
        }
        return null;
    }
}
