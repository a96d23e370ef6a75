package com.gentoro.kbo.compiler;

import org.apache.commons.configuration2.Configuration;

/**
 * Evidence weights for role inference. The sort key outweighs projected columns, which outweigh
 * incidental mentions. The defaults are tunable, not derived.
 */
public record RoleWeights(int orderBy, int select, int mention) {

  public static final RoleWeights DEFAULT = new RoleWeights(10, 3, 1);

  public static RoleWeights from(Configuration configuration) {
    return new RoleWeights(
        configuration.getInt("compiler.role-weights.order-by", DEFAULT.orderBy()),
        configuration.getInt("compiler.role-weights.select", DEFAULT.select()),
        configuration.getInt("compiler.role-weights.mention", DEFAULT.mention()));
  }
}
