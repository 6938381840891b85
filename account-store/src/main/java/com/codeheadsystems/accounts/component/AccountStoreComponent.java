package com.codeheadsystems.accounts.component;

import com.codeheadsystems.accounts.AccountStore;
import com.codeheadsystems.accounts.model.Configuration;
import com.codeheadsystems.accounts.module.AccountStoreModule;
import com.codeheadsystems.accounts.module.ConfigurationModule;
import dagger.Component;
import javax.inject.Singleton;

/**
 * Creates the pieces needed to talk to the accounts table.
 */
@Singleton
@Component(modules = {AccountStoreModule.class, ConfigurationModule.class})
public interface AccountStoreComponent {

  /**
   * Instance account store component.
   *
   * @param configuration the configuration
   * @return the account store component
   */
  static AccountStoreComponent instance(final Configuration configuration) {
    return DaggerAccountStoreComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * The account store. Opens the DynamoDB client on first use.
   *
   * @return the account store
   */
  AccountStore accountStore();

}
