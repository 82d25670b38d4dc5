/*
 * Copyright (C) 2018-2023 layline.io GmbH <http://www.layline.io>
 */

package com.deigmueller.em_link.application;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.apache.commons.lang3.StringUtils;
import org.apache.pekko.actor.typed.ActorSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Application {
  public static final Logger LOGGER = LoggerFactory.getLogger("em-link");

  public static void main(String[] args) {
    Config config = ConfigFactory.load();

    logStartupBanner();

    try {
      LOGGER.info("initializing actor system");
      ActorSystem<EmLink.Command> actorSystem = ActorSystem.create(EmLink.create(), "em-link", config);

      actorSystem.getWhenTerminated().whenComplete((done, throwable) -> LOGGER.info("actor system terminated"));
    } catch (Exception e) {
      LOGGER.error("failed to initialize the actor system", e);
    }
  }

  private static void logStartupBanner() {
    String product = "# Energy monitor link " + Version.getVersion() + " (" + Version.getBuildTime() + ") #";
    String hLine = StringUtils.repeat("#", product.length());

    LOGGER.info(hLine);
    LOGGER.info(product);
    LOGGER.info(hLine);
  }
}
