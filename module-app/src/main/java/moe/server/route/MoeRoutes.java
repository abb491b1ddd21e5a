package moe.server.route;

/** The public routes. Paths are an external contract; do not rename. */
public final class MoeRoutes {

  public static final String HOME = "home";
  public static final String DOCS = "docs";
  public static final String ABOUT = "about";
  public static final String GP_EI = "gp_ei";
  public static final String GP_EI_PRETTY = "gp_ei_pretty";
  public static final String GP_MEAN_VAR = "gp_mean_var";
  public static final String GP_MEAN_VAR_PRETTY = "gp_mean_var_pretty";
  public static final String GP_NEXT_POINTS_EPI = "gp_next_points_epi";
  public static final String GP_NEXT_POINTS_EPI_PRETTY = "gp_next_points_epi_pretty";

  private MoeRoutes() {}

  public static RouteTable table() {
    return RouteTable.builder()
        .add(HOME, "/")
        .add(DOCS, "/docs")
        .add(ABOUT, "/about")
        .add(GP_EI, "/gp/ei")
        .add(GP_EI_PRETTY, "/gp/ei/pretty")
        .add(GP_MEAN_VAR, "/gp/mean_var")
        .add(GP_MEAN_VAR_PRETTY, "/gp/mean_var/pretty")
        .add(GP_NEXT_POINTS_EPI, "/gp/next_points/epi")
        .add(GP_NEXT_POINTS_EPI_PRETTY, "/gp/next_points/epi/pretty")
        .build();
  }
}
