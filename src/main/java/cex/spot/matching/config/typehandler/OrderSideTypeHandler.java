package cex.spot.matching.config.typehandler;

import cex.spot.matching.enums.OrderSide;
import org.apache.ibatis.type.MappedJdbcTypes;
import org.apache.ibatis.type.MappedTypes;
import org.apache.ibatis.type.JdbcType;

/**
 * MyBatis TypeHandler for OrderSide enum
 * Maps between OrderSide enum and VARCHAR side column
 */
@MappedTypes(OrderSide.class)
@MappedJdbcTypes(JdbcType.VARCHAR)
public class OrderSideTypeHandler extends NamedEnumTypeHandler<OrderSide> {

    public OrderSideTypeHandler() {
        super(OrderSide.class);
    }
}
