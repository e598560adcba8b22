package cex.spot.matching.config.typehandler;

import cex.spot.matching.enums.OrderStatus;
import org.apache.ibatis.type.MappedJdbcTypes;
import org.apache.ibatis.type.MappedTypes;
import org.apache.ibatis.type.JdbcType;

/**
 * MyBatis TypeHandler for OrderStatus enum
 * Maps between OrderStatus enum and VARCHAR status column
 */
@MappedTypes(OrderStatus.class)
@MappedJdbcTypes(JdbcType.VARCHAR)
public class OrderStatusTypeHandler extends NamedEnumTypeHandler<OrderStatus> {

    public OrderStatusTypeHandler() {
        super(OrderStatus.class);
    }
}
