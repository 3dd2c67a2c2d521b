package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** NetFlow/IPFIX records stored as OCSF network activity. */
public class FlowsPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("flows", "ocsf_network_activity")
            .timeColumn("time")
            .text("src_endpoint_ip", "src_ip")
            .text("dst_endpoint_ip", "dst_ip")
            .texts("protocol_name", "sampler_address")
            .integer("protocol_num", "proto")
            .integer("src_endpoint_port", "src_port")
            .integer("dst_endpoint_port", "dst_port")
            .integerRange("bytes_total")
            .integerRange("packets_total")
            .order("time")
            .order("bytes_total")
            .order("packets_total")
            .order("bytes_in")
            .order("bytes_out")
            .defaultOrder("time", OrderDirection.DESC)
            .defaultOrder("bytes_total", OrderDirection.DESC)
            .build();

    public FlowsPlanner() {
        super(TABLE, StatsGrammar.AGG_BY_FIELD, Entity.FLOWS);
    }
}
