package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.ValueKind;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** SNMP-discovered interfaces. */
public class InterfacesPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("interfaces", "discovered_interfaces")
            .timeColumn("timestamp")
            .text("device_id")
            .text("device_ip", "ip")
            .texts("poller_id", "agent_id", "if_name", "if_alias")
            .text("if_descr", "description")
            .text("if_phys_address", "mac")
            .integer("if_index")
            .integer("if_admin_status")
            .integer("if_oper_status", "status")
            .integerRange("if_speed", "speed")
            .field("ip_addresses", ValueKind.TEXT_ARRAY_OVERLAP, ColumnHandler.MEMBERSHIP, "ip_address")
            .order("timestamp")
            .order("device_ip")
            .order("device_id")
            .order("if_name")
            .order("if_descr")
            .order("if_index")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("device_id", OrderDirection.ASC)
            .defaultOrder("if_index", OrderDirection.ASC)
            .build();

    public InterfacesPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.INTERFACES);
    }
}
