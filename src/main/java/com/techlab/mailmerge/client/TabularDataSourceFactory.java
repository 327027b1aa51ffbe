package com.techlab.mailmerge.client;

import com.techlab.mailmerge.model.DataSourceCredentials;

public interface TabularDataSourceFactory {

    TabularDataSource connect(DataSourceCredentials credentials);
}
